package com.medica.factory.optimizer;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A policy per week of the horizon. Week {@code w} covers days
 * {@code startDay + 7w .. startDay + 7w + 6}; days past the last week reuse it.
 * A single-week policy is the same policy for the whole run.
 */
@ToString
@EqualsAndHashCode
public class WeeklyPolicy {

    public static final int DAYS_PER_WEEK = 7;
    public static final int WEEKS_PER_YEAR = 52;

    private final List<PolicyParameters> weeks;

    public WeeklyPolicy(List<PolicyParameters> weeks) {
        if (weeks == null || weeks.isEmpty()) {
            throw new IllegalArgumentException("A weekly policy needs at least one week");
        }
        List<PolicyParameters> copies = new ArrayList<>(weeks.size());
        for (PolicyParameters week : weeks) {
            if (week == null) {
                throw new IllegalArgumentException("Week parameters cannot be null");
            }
            copies.add(week.copy());
        }
        this.weeks = copies;
    }

    /** The same parameters for the whole horizon. */
    public static WeeklyPolicy single(PolicyParameters params) {
        return new WeeklyPolicy(List.of(params));
    }

    /** {@code weekCount} copies of {@code params}, ready to diverge week by week. */
    public static WeeklyPolicy uniform(PolicyParameters params, int weekCount) {
        return new WeeklyPolicy(Collections.nCopies(weekCount, params));
    }

    public static WeeklyPolicy random(int weekCount, Random random) {
        List<PolicyParameters> weeks = new ArrayList<>(weekCount);
        for (int w = 0; w < weekCount; w++) {
            weeks.add(PolicyParameters.random(random));
        }
        return new WeeklyPolicy(weeks);
    }

    public int weekCount() {
        return weeks.size();
    }

    public boolean isWeekly() {
        return weeks.size() > 1;
    }

    /** Zero-based week of {@code day}, clamped to the last defined week. */
    public int weekIndex(int day, int startDay) {
        int week = Math.max(0, day - startDay) / DAYS_PER_WEEK;
        return Math.min(week, weeks.size() - 1);
    }

    public PolicyParameters forDay(int day, int startDay) {
        return weeks.get(weekIndex(day, startDay));
    }

    public PolicyParameters week(int index) {
        return weeks.get(index);
    }

    /** First week; stands in for the whole policy wherever a single value is needed. */
    public PolicyParameters representative() {
        return weeks.get(0);
    }

    public List<PolicyParameters> weeks() {
        return Collections.unmodifiableList(weeks);
    }

    public WeeklyPolicy clamp() {
        List<PolicyParameters> clamped = new ArrayList<>(weeks.size());
        for (PolicyParameters week : weeks) {
            clamped.add(week.clamp());
        }
        return new WeeklyPolicy(clamped);
    }

    public WeeklyPolicy copy() {
        return new WeeklyPolicy(weeks);
    }
}
