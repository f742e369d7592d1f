package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.DatasetShape;
import com.autods.core.model.FeatureTypes;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReflectionStatus;
import com.autods.core.model.ReplanResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppendingReplanStrategyTest {

    private final AppendingReplanStrategy strategy = new AppendingReplanStrategy();

    @Test
    @DisplayName("extends plan and notes without touching the inputs")
    void extendsWithoutMutation() {
        List<String> plan = List.of("profile_dataset", "train_models");
        DatasetProfile profile = new DatasetProfile(new DatasetShape(10, 2), List.of("a", "y"), Map.of(), "y",
                "nominal", true, new FeatureTypes(List.of("a"), List.of()), Map.of(), Map.of(), 1.0,
                List.of("Small dataset"));
        Reflection reflection = new Reflection(ReflectionStatus.NEEDS_ATTENTION, "Logistic",
                List.of("weak"), List.of(), true);

        ReplanResult result = strategy.apply(plan, profile, reflection);

        assertEquals(List.of("profile_dataset", "train_models", "replan_attempt"), result.plan());
        assertEquals(List.of("Small dataset", "Replan: adjusting strategy after reflection."),
                result.profile().notes());
        assertEquals(List.of("profile_dataset", "train_models"), plan);
        assertEquals(List.of("Small dataset"), profile.notes());
        assertEquals(profile.shape(), result.profile().shape());
    }
}
