package personal.agenda.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import personal.agenda.scheduling.availability.application.port.in.AvailabilityCheckQuery;
import personal.agenda.scheduling.availability.application.port.in.AvailableStaffQuery;
import personal.agenda.scheduling.availability.application.port.in.CheckStaffAvailabilityUseCase;
import personal.agenda.scheduling.availability.application.port.in.FindAvailableStaffUseCase;
import personal.agenda.scheduling.availability.application.port.in.GenerateTimeSlotsUseCase;
import personal.agenda.scheduling.availability.application.port.in.GetServiceSlotsUseCase;
import personal.agenda.scheduling.availability.application.port.in.ServiceSlotsQuery;
import personal.agenda.scheduling.availability.application.port.in.TimeSlotQuery;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.availability.domain.model.AvailabilityStatus;
import personal.agenda.scheduling.availability.domain.model.AvailableStaff;
import personal.agenda.scheduling.availability.domain.model.SlotCheck;
import personal.agenda.scheduling.availability.domain.model.StaffAvailability;
import personal.agenda.scheduling.availability.domain.model.StaffServiceSlots;
import personal.agenda.scheduling.availability.domain.model.WorkingDay;
import personal.agenda.scheduling.availability.domain.service.ScheduleResolver;
import personal.agenda.scheduling.availability.domain.service.SlotGenerator;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.application.service.SchedulingOperations;
import personal.agenda.scheduling.booking.domain.exception.UpstreamFailureException;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;
import personal.agenda.scheduling.catalog.application.port.out.ServiceCatalog;
import personal.agenda.scheduling.catalog.domain.exception.ServiceNotFoundException;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;
import personal.agenda.scheduling.staff.application.service.StaffQueryCacheService;
import personal.agenda.scheduling.staff.domain.exception.StaffNotFoundException;
import personal.agenda.scheduling.staff.domain.model.MatchedStaff;
import personal.agenda.scheduling.staff.domain.model.Skill;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Availability Service
 * 가용 시각 생성, 특정 시각 가용 여부 판정, 서비스별 가용 직원 조회
 *
 * 슬롯 목록은 (테넌트, 직원, 날짜, 소요 시간) 단위로 캐싱한다.
 * 특정 시각 판정과 가용 직원 조회는 항상 최신 예약을 조회한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService implements GenerateTimeSlotsUseCase, CheckStaffAvailabilityUseCase,
        FindAvailableStaffUseCase, GetServiceSlotsUseCase {

    private static final int MAX_SUGGESTED_TIMES = 3;

    private final StaffQueryCacheService staffQueryCacheService;
    private final BookingRepository bookingRepository;
    private final ServiceCatalog serviceCatalog;
    private final AvailabilityCacheRepository availabilityCache;
    private final ScheduleResolver scheduleResolver;
    private final SlotGenerator slotGenerator;

    @Override
    public SchedulingResult<List<String>> generateTimeSlots(TimeSlotQuery query) {
        return SchedulingOperations.capture("generateTimeSlots", () -> {
            StaffMember staff = staffQueryCacheService.getStaff(query.staffId());
            staff.ensureActive();
            return slotsFor(staff, query.date(), query.durationMinutes());
        });
    }

    @Override
    public SchedulingResult<StaffAvailability> isStaffAvailableAt(AvailabilityCheckQuery query) {
        return SchedulingOperations.capture("isStaffAvailableAt", () -> {
            StaffMember staff = staffQueryCacheService.getStaff(query.staffId());
            staff.ensureActive();

            SlotCheck check = evaluate(staff, query.date(), query.startTime(), query.durationMinutes());
            if (check.isAvailable()) {
                return new StaffAvailability(staff.id(), query.date(), query.startTime(),
                        query.durationMinutes(), AvailabilityStatus.AVAILABLE, null, List.of());
            }

            List<String> suggestions = suggestAlternatives(staff, query);
            log.debug("Staff unavailable: staffId={}, date={}, startTime={}, status={}, suggestions={}",
                    staff.id(), query.date(), query.startTime(), check.status(), suggestions);
            return new StaffAvailability(staff.id(), query.date(), query.startTime(),
                    query.durationMinutes(), check.status(), check.conflictingBooking(), suggestions);
        });
    }

    @Override
    public SchedulingResult<List<AvailableStaff>> listAvailableStaffForService(AvailableStaffQuery query) {
        return SchedulingOperations.capture("listAvailableStaffForService", () -> {
            ServiceOffering service = findService(query.tenantId(), query.serviceId());
            int requestedDuration = query.durationMinutes() != null
                    ? query.durationMinutes()
                    : service.durationMinutes();

            List<MatchedStaff> candidates = staffQueryCacheService.findCapableStaff(query.tenantId(), query.serviceId());
            List<AvailableStaff> available = new ArrayList<>();
            DataAccessException lastFailure = null;
            int failures = 0;

            for (MatchedStaff candidate : candidates) {
                StaffMember staff = candidate.staff();
                int duration = candidate.effectiveDuration(requestedDuration);
                try {
                    if (evaluate(staff, query.date(), query.startTime(), duration).isAvailable()) {
                        available.add(new AvailableStaff(staff.id(), staff.name(), staff.position(),
                                candidate.skill().experienceLevel(), duration, service.price()));
                    }
                } catch (DataAccessException e) {
                    failures++;
                    lastFailure = e;
                    log.error("Availability lookup failed, skipping staff: staffId={}, date={}, error={}",
                            staff.id(), query.date(), e.getMessage());
                }
            }

            if (!candidates.isEmpty() && failures == candidates.size()) {
                throw new UpstreamFailureException(
                        String.format("Availability lookup failed for all candidates: serviceId=%d, count=%d",
                                query.serviceId(), failures),
                        lastFailure);
            }

            log.info("Available staff listed: tenantId={}, serviceId={}, date={}, startTime={}, candidates={}, available={}",
                    query.tenantId(), query.serviceId(), query.date(), query.startTime(),
                    candidates.size(), available.size());
            return List.copyOf(available);
        });
    }

    @Override
    public SchedulingResult<StaffServiceSlots> getServiceSlots(ServiceSlotsQuery query) {
        return SchedulingOperations.capture("getServiceSlots", () -> {
            ServiceOffering service = findService(query.tenantId(), query.serviceId());
            StaffMember staff = staffQueryCacheService.getStaff(query.staffId());
            if (!staff.belongsTo(query.tenantId())) {
                throw new StaffNotFoundException(query.staffId());
            }
            staff.ensureActive();
            Skill skill = staff.ensureCapableOf(service.id());

            int duration = skill.effectiveDuration(service.durationMinutes());
            List<String> slots = slotsFor(staff, query.date(), duration);
            return new StaffServiceSlots(staff.id(), staff.name(), service.id(), service.name(),
                    query.date(), service.price(), duration, slots);
        });
    }

    /**
     * 캐시 우선 슬롯 조회, MISS 시 생성 후 저장
     * 예약 조회 이후 무효화(예약 생성/상태 변경)가 있었다면 계산한 목록은 반환만 하고 캐시에 남기지 않는다.
     */
    private List<String> slotsFor(StaffMember staff, LocalDate date, int durationMinutes) {
        Optional<List<String>> cached = availabilityCache.findSlots(staff.tenantId(), staff.id(), date, durationMinutes);
        if (cached.isPresent()) {
            return cached.get();
        }

        long generation = availabilityCache.slotGeneration();
        List<String> slots = scheduleResolver.resolve(staff.workSchedule(), date)
                .map(day -> SlotGenerator.format(slotGenerator.generate(day, durationMinutes,
                        bookingRepository.findByStaffAndDate(staff.id(), date))))
                .orElseGet(List::of);

        availabilityCache.saveSlotsIfCurrent(staff.tenantId(), staff.id(), date, durationMinutes, slots, generation);
        log.debug("Slots generated: staffId={}, date={}, duration={}, count={}",
                staff.id(), date, durationMinutes, slots.size());
        return slots;
    }

    /**
     * 최신 예약 기준 단일 시각 판정
     */
    private SlotCheck evaluate(StaffMember staff, LocalDate date, LocalTime startTime, int durationMinutes) {
        Optional<WorkingDay> workingDay = scheduleResolver.resolve(staff.workSchedule(), date);
        if (workingDay.isEmpty()) {
            return SlotCheck.of(AvailabilityStatus.NOT_WORKING);
        }
        if (!TimeWindow.fitsWithinDay(startTime, durationMinutes)) {
            return SlotCheck.of(AvailabilityStatus.OUTSIDE_WORKING_HOURS);
        }
        TimeWindow candidate = TimeWindow.starting(startTime, durationMinutes);
        return slotGenerator.check(workingDay.get(), candidate,
                bookingRepository.findByStaffAndDate(staff.id(), date));
    }

    private List<String> suggestAlternatives(StaffMember staff, AvailabilityCheckQuery query) {
        List<LocalTime> slots = SlotGenerator.parse(slotsFor(staff, query.date(), query.durationMinutes()));
        return SlotGenerator.format(slotGenerator.nearest(slots, query.startTime(), MAX_SUGGESTED_TIMES));
    }

    private ServiceOffering findService(String tenantId, Long serviceId) {
        return serviceCatalog.findById(tenantId, serviceId)
                .orElseThrow(() -> new ServiceNotFoundException(tenantId, serviceId));
    }
}
