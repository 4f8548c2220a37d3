package com.daytrader.calendar;

import com.daytrader.domain.enums.Phase;
import com.daytrader.exception.ConfigurationException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Market hours, holidays and phase boundaries.
 *
 * <p>A pure function of wall-clock time and the holiday calendar: it holds no mutable state, so
 * the engine and the fill reconciler can query it concurrently. Phases are always computed from
 * absolute time against the day's session bounds, never from "has the wake time passed".
 *
 * <p>On LATE_OPEN days every boundary of the day moves by
 * {@link HolidayCalendarConfig#getLateOpenOffset()}.
 */
@Service
public class TradingCalendarService {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private static final List<Phase> DAY_PHASES = List.of(
            Phase.PRE_MARKET,
            Phase.OPENING,
            Phase.MIDDAY,
            Phase.CLOSING_PREP,
            Phase.CLOSING_EXECUTION,
            Phase.POST_MARKET);

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final SessionScheduleConfig sessionScheduleConfig;
    private final ZoneId zoneId;
    private final Map<Phase, LocalTime> phaseStarts = new EnumMap<>(Phase.class);

    public TradingCalendarService(
            HolidayCalendarConfig holidayCalendarConfig, SessionScheduleConfig sessionScheduleConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.sessionScheduleConfig = sessionScheduleConfig;
        this.zoneId = ZoneId.of(sessionScheduleConfig.getTimezone());

        phaseStarts.put(Phase.PRE_MARKET, sessionScheduleConfig.getPreMarketStart());
        phaseStarts.put(Phase.OPENING, sessionScheduleConfig.getOpeningStart());
        phaseStarts.put(Phase.MIDDAY, sessionScheduleConfig.getMiddayStart());
        phaseStarts.put(Phase.CLOSING_PREP, sessionScheduleConfig.getClosingPrepStart());
        phaseStarts.put(Phase.CLOSING_EXECUTION, sessionScheduleConfig.getClosingExecutionStart());
        phaseStarts.put(Phase.POST_MARKET, sessionScheduleConfig.getPostMarketStart());
        validateBoundaries();

        log.info(
                "Trading calendar initialised: exchange={}, zone={}, session {}-{}, {} calendar entries",
                holidayCalendarConfig.getExchange(),
                zoneId,
                sessionScheduleConfig.getPreMarketStart(),
                sessionScheduleConfig.getPostMarketStart(),
                holidayCalendarConfig.getHolidays().size());
    }

    /** Current wall-clock time in the exchange's timezone. */
    public LocalDateTime now() {
        return LocalDateTime.now(zoneId);
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    // ========================
    // TRADING DAYS
    // ========================

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return hasEntry(date, HolidayType.FULL_HOLIDAY);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    public boolean isLateOpen(LocalDate date) {
        return hasEntry(date, HolidayType.LATE_OPEN);
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the previous trading day before the given date. */
    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    // ========================
    // PHASES
    // ========================

    /**
     * Resolves the phase for an instant.
     *
     * @return empty on non-trading days and before the session start of a trading day
     */
    public Optional<Phase> resolvePhase(LocalDateTime now) {
        LocalDate date = now.toLocalDate();
        if (!isTradingDay(date) || now.isBefore(sessionStart(date))) {
            return Optional.empty();
        }
        Phase resolved = Phase.PRE_MARKET;
        for (Phase phase : DAY_PHASES) {
            if (!now.isBefore(phaseStart(date, phase))) {
                resolved = phase;
            }
        }
        return Optional.of(resolved);
    }

    /** True while the exchange accepts orders (OPENING through CLOSING_EXECUTION). */
    public boolean isMarketOpen(LocalDateTime now) {
        return resolvePhase(now).map(Phase::isMarketOpen).orElse(false);
    }

    public LocalDateTime sessionStart(LocalDate date) {
        return phaseStart(date, Phase.PRE_MARKET);
    }

    /** Inclusive start of a phase on the given date, shifted on late-open days. */
    public LocalDateTime phaseStart(LocalDate date, Phase phase) {
        return atSessionTime(date, phaseStartTime(phase));
    }

    /** Configured start of a phase on a regular day. */
    public LocalTime phaseStartTime(Phase phase) {
        LocalTime start = phaseStarts.get(phase);
        if (start == null) {
            throw new IllegalArgumentException("Phase has no time boundary: " + phase);
        }
        return start;
    }

    /** Configured end of a phase on a regular day; POST_MARKET ends at {@link LocalTime#MAX}. */
    public LocalTime phaseEndTime(Phase phase) {
        Phase next = phase.next();
        return next == null ? LocalTime.MAX : phaseStartTime(next);
    }

    /**
     * Maps a regular-day time of day onto the given date, applying the late-open shift.
     */
    public LocalDateTime atSessionTime(LocalDate date, LocalTime time) {
        LocalDateTime dateTime = date.atTime(time);
        if (isLateOpen(date)) {
            return dateTime.plus(holidayCalendarConfig.getLateOpenOffset());
        }
        return dateTime;
    }

    /** Exclusive end of a phase; POST_MARKET ends at midnight. */
    public LocalDateTime phaseEnd(LocalDate date, Phase phase) {
        Phase next = phase.next();
        if (next == null) {
            return date.plusDays(1).atStartOfDay();
        }
        return phaseStart(date, next);
    }

    /**
     * True while fill polling is suspended (closing auction). Uses the same late-open shift.
     */
    public boolean isInFillBlackout(LocalDateTime now) {
        LocalDate date = now.toLocalDate();
        LocalDateTime start = atSessionTime(date, sessionScheduleConfig.getFillBlackoutStart());
        LocalDateTime end = atSessionTime(date, sessionScheduleConfig.getFillBlackoutEnd());
        return !now.isBefore(start) && now.isBefore(end);
    }

    private boolean hasEntry(LocalDate date, HolidayType type) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == type);
    }

    private void validateBoundaries() {
        LocalTime previous = null;
        for (Phase phase : DAY_PHASES) {
            LocalTime start = phaseStarts.get(phase);
            if (start == null) {
                throw new ConfigurationException("Missing start time for phase " + phase);
            }
            if (previous != null && !start.isAfter(previous)) {
                throw new ConfigurationException(
                        "Phase boundaries must be strictly increasing: " + phase + " starts at " + start);
            }
            previous = start;
        }
    }
}
