package personal.agenda.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.agenda.scheduling.availability.application.port.out.AvailabilityCacheRepository;
import personal.agenda.scheduling.availability.domain.model.SlotCheck;
import personal.agenda.scheduling.availability.domain.model.WorkingDay;
import personal.agenda.scheduling.availability.domain.service.ScheduleResolver;
import personal.agenda.scheduling.availability.domain.service.SlotGenerator;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.agenda.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.agenda.scheduling.booking.application.port.out.BookingRepository;
import personal.agenda.scheduling.booking.domain.exception.ScheduleUnavailableException;
import personal.agenda.scheduling.booking.domain.exception.SchedulingConflictException;
import personal.agenda.scheduling.booking.domain.model.Booking;
import personal.agenda.scheduling.booking.domain.model.SchedulingResult;
import personal.agenda.scheduling.booking.domain.model.TimeWindow;
import personal.agenda.scheduling.booking.domain.service.ConflictChecker;
import personal.agenda.scheduling.catalog.application.port.out.ServiceCatalog;
import personal.agenda.scheduling.catalog.application.port.out.TenantDirectory;
import personal.agenda.scheduling.catalog.domain.exception.ServiceNotFoundException;
import personal.agenda.scheduling.catalog.domain.exception.TenantNotFoundException;
import personal.agenda.scheduling.catalog.domain.model.ServiceOffering;
import personal.agenda.scheduling.staff.application.port.out.StaffRepository;
import personal.agenda.scheduling.staff.domain.exception.StaffNotFoundException;
import personal.agenda.scheduling.staff.domain.model.Skill;
import personal.agenda.scheduling.staff.domain.model.StaffMember;

/**
 * Booking Orchestrator
 * 예약 생성 흐름 조율
 *
 * 1. 테넌트/서비스 검증
 * 2. (직원 지정 시) 직원 소속, 활성, 스킬 검증 → 실제 소요 시간 결정
 * 3. 근무 시간/휴게 시간 검증
 * 4. 충돌 검사 (직원 지정: 해당 직원 예약, 미지정: 테넌트 당일 전체 예약)
 * 5. PENDING 상태로 저장 후 슬롯 캐시 무효화
 *
 * 검증 실패 시 저장소에 쓰지 않는다.
 * 충돌 검사와 저장 사이의 동시 요청은 막지 않는다 (저장소 제약 없음).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingOrchestrator implements CreateBookingUseCase {

    private final TenantDirectory tenantDirectory;
    private final ServiceCatalog serviceCatalog;
    private final StaffRepository staffRepository;
    private final BookingRepository bookingRepository;
    private final AvailabilityCacheRepository availabilityCache;
    private final ScheduleResolver scheduleResolver;
    private final SlotGenerator slotGenerator;

    @Override
    public SchedulingResult<Booking> createBooking(CreateBookingCommand command) {
        return SchedulingOperations.capture("createBooking", () -> {
            log.info("Booking request: tenantId={}, serviceId={}, staffId={}, date={}, startTime={}",
                    command.tenantId(), command.serviceId(), command.staffId(), command.date(), command.startTime());

            if (!tenantDirectory.exists(command.tenantId())) {
                throw new TenantNotFoundException(command.tenantId());
            }
            ServiceOffering service = serviceCatalog.findById(command.tenantId(), command.serviceId())
                    .orElseThrow(() -> new ServiceNotFoundException(command.tenantId(), command.serviceId()));

            Booking booking = command.hasStaff()
                    ? prepareStaffBooking(command, service)
                    : prepareUnassignedBooking(command, service);

            Booking saved = bookingRepository.save(booking);
            if (saved.isAssigned()) {
                availabilityCache.evictSlots(saved.tenantId(), saved.staffId(), saved.date());
            }

            log.info("Booking created: bookingId={}, staffId={}, date={}, startTime={}, endTime={}",
                    saved.id(), saved.staffId(), saved.date(), saved.startTime(), saved.endTime());
            return saved;
        });
    }

    private Booking prepareStaffBooking(CreateBookingCommand command, ServiceOffering service) {
        // 쓰기 경로는 캐시를 거치지 않는다
        StaffMember staff = staffRepository.findById(command.staffId())
                .filter(found -> found.belongsTo(command.tenantId()))
                .orElseThrow(() -> new StaffNotFoundException(command.staffId()));
        staff.ensureActive();
        Skill skill = staff.ensureCapableOf(service.id());

        int duration = skill.effectiveDuration(service.durationMinutes());
        WorkingDay workingDay = scheduleResolver.resolve(staff.workSchedule(), command.date())
                .orElseThrow(() -> ScheduleUnavailableException.notWorking(staff.id(), command.date()));
        TimeWindow requested = requestedWindow(command, duration);

        SlotCheck check = slotGenerator.check(workingDay, requested,
                bookingRepository.findByStaffAndDate(staff.id(), command.date()));
        switch (check.status()) {
            case AVAILABLE -> log.debug("Requested window is free: staffId={}, window={}", staff.id(), requested);
            case OUTSIDE_WORKING_HOURS -> throw ScheduleUnavailableException.outsideWorkingHours(staff.id(), requested);
            case DURING_BREAK -> throw ScheduleUnavailableException.duringBreak(staff.id(), requested);
            case CONFLICT -> throw new SchedulingConflictException(check.conflictingBooking());
            default -> throw ScheduleUnavailableException.notWorking(staff.id(), command.date());
        }

        return Booking.create(command.tenantId(), service, staff, command.date(), command.startTime(),
                duration, command.client(), command.notes());
    }

    private Booking prepareUnassignedBooking(CreateBookingCommand command, ServiceOffering service) {
        int duration = service.durationMinutes();
        TimeWindow requested = requestedWindow(command, duration);

        ConflictChecker.findFirstConflict(requested,
                        bookingRepository.findByTenantAndDate(command.tenantId(), command.date()))
                .ifPresent(conflict -> {
                    throw new SchedulingConflictException(conflict);
                });

        return Booking.create(command.tenantId(), service, null, command.date(), command.startTime(),
                duration, command.client(), command.notes());
    }

    private TimeWindow requestedWindow(CreateBookingCommand command, int duration) {
        if (!TimeWindow.fitsWithinDay(command.startTime(), duration)) {
            throw ScheduleUnavailableException.crossesMidnight(command.startTime(), duration);
        }
        return TimeWindow.starting(command.startTime(), duration);
    }
}
