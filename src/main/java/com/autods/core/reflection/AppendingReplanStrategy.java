package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReplanResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference strategy: records the attempt in the plan and in the profile notes.
 */
public class AppendingReplanStrategy implements ReplanStrategy {

    public static final String REPLAN_TASK = "replan_attempt";
    public static final String REPLAN_NOTE = "Replan: adjusting strategy after reflection.";

    @Override
    public ReplanResult apply(List<String> plan, DatasetProfile profile, Reflection reflection) {
        List<String> newPlan = new ArrayList<>(plan);
        newPlan.add(REPLAN_TASK);

        List<String> notes = new ArrayList<>(profile.notes());
        notes.add(REPLAN_NOTE);

        return new ReplanResult(newPlan, profile.withNotes(notes));
    }
}
