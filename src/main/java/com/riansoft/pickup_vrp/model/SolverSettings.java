package com.riansoft.pickup_vrp.model;

public class SolverSettings {
    public final long slackMinutes;
    public final long horizonMinutes;
    public final long searchTimeBudgetSeconds;

    public SolverSettings(long slackMinutes, long horizonMinutes, long searchTimeBudgetSeconds) {
        if (slackMinutes < 0 || horizonMinutes <= 0 || searchTimeBudgetSeconds <= 0) {
            throw new IllegalArgumentException("solver settings out of range: slack=" + slackMinutes
                    + ", horizon=" + horizonMinutes + ", budget=" + searchTimeBudgetSeconds);
        }
        this.slackMinutes = slackMinutes;
        this.horizonMinutes = horizonMinutes;
        this.searchTimeBudgetSeconds = searchTimeBudgetSeconds;
    }
}
