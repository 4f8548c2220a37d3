package com.daytrader.core.engine;

import java.time.LocalDate;

/**
 * Work run once per trading day when the session enters POST_MARKET (daily report, research
 * hooks). Each task is isolated: a failure is logged and alerted and the next task still runs.
 */
public interface EndOfDayTask {

    String getName();

    void run(LocalDate tradingDate);
}
