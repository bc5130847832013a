package com.leadgen.backend.services.budget;

import com.leadgen.backend.enums.Capability;
import com.leadgen.backend.enums.DenialReason;

/**
 * Why the scheduler refused a grant or an item admission. {@code capability} is null for admissions.
 */
public record Denial(DenialReason reason, Capability capability, String message) {

    public static Denial budgetExceeded(Capability capability, String message) {
        return new Denial(DenialReason.BUDGET_EXCEEDED, capability, message);
    }
}
