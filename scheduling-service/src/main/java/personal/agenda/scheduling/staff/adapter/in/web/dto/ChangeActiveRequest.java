package personal.agenda.scheduling.staff.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

public record ChangeActiveRequest(
        @NotNull(message = "활성 여부는 필수입니다.")
        Boolean active
) {
}
