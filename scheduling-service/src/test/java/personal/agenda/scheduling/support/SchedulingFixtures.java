package personal.agenda.scheduling.support;

import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.BookingStatus;
import personal.agenda.scheduling.booking.domain.model.ClientInfo;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;
import personal.agenda.scheduling.staff.domain.model.DaySchedule;
import personal.agenda.scheduling.staff.domain.model.ExperienceLevel;
import personal.agenda.scheduling.staff.domain.model.Skill;
import personal.agenda.scheduling.staff.domain.model.StaffMember;
import personal.agenda.scheduling.staff.domain.model.WorkSchedule;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;

/**
 * 테스트용 도메인 객체 생성 헬퍼
 */
public final class SchedulingFixtures {

    public static final String TENANT_ID = "salon-1";
    public static final String OTHER_TENANT_ID = "salon-2";
    public static final Long SERVICE_ID = 10L;
    public static final Long STAFF_ID = 1L;
    /**
     * 월요일
     */
    public static final LocalDate MONDAY = LocalDate.of(2024, 1, 15);
    public static final LocalDate SUNDAY = LocalDate.of(2024, 1, 21);

    private SchedulingFixtures() {
    }

    public static LocalTime time(String value) {
        return LocalTime.parse(value);
    }

    /**
     * 평일 09:00-17:00, 휴게 12:00-13:00
     */
    public static WorkSchedule weekdaySchedule() {
        return WorkSchedule.weekly(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
                DaySchedule.withBreak(time("09:00"), time("17:00"), time("12:00"), time("13:00")));
    }

    public static ServiceOffering haircut() {
        return new ServiceOffering(SERVICE_ID, TENANT_ID, "커트", new BigDecimal("20000"), 30, true);
    }

    public static StaffMember staff(Long id, String name, Skill... skills) {
        return new StaffMember(id, TENANT_ID, name, name + "@example.com", "디자이너", true,
                List.of(skills), weekdaySchedule());
    }

    public static StaffMember haircutStaff() {
        return staff(STAFF_ID, "김민지", Skill.of(SERVICE_ID, "커트"));
    }

    public static Skill skillWithDuration(Long serviceId, int duration) {
        return new Skill(serviceId, "커트", ExperienceLevel.EXPERT, duration, true);
    }

    public static ClientInfo client() {
        return new ClientInfo("홍길동", "010-1234-5678", "hong@example.com");
    }

    public static Booking booking(Long id, Long staffId, LocalDate date, String start, String end, BookingStatus status) {
        LocalTime startTime = time(start);
        LocalTime endTime = time(end);
        int duration = (int) Duration.between(startTime, endTime).toMinutes();
        return new Booking(id, TENANT_ID, SERVICE_ID, "커트", new BigDecimal("20000"), 30,
                staffId, staffId != null ? "김민지" : null, date, startTime, endTime, duration,
                status, client(), null, LocalDateTime.now(), LocalDateTime.now());
    }

    public static Booking withId(Booking booking, Long id) {
        return new Booking(id, booking.tenantId(), booking.serviceId(), booking.serviceName(),
                booking.servicePrice(), booking.serviceDuration(), booking.staffId(), booking.staffName(),
                booking.date(), booking.startTime(), booking.endTime(), booking.actualDuration(),
                booking.status(), booking.client(), booking.notes(), booking.createdAt(), booking.updatedAt());
    }

    public static Booking confirmedBooking(Long id, String start, String end) {
        return booking(id, STAFF_ID, MONDAY, start, end, BookingStatus.CONFIRMED);
    }
}
