package com.leadgen.backend.services.pipeline;

import com.leadgen.backend.services.budget.BudgetAccount;
import com.leadgen.backend.services.budget.ItemAllowance;

import java.util.List;

/**
 * What a stage needs besides the item: the campaign it works for and the budget it spends.
 *
 * @param allowance budget reserved for the current item; null for unit-level work
 */
public record StageContext(Long campaignId, List<String> keywords, BudgetAccount account, ItemAllowance allowance) {

    public StageContext {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public StageContext withAllowance(ItemAllowance itemAllowance) {
        return new StageContext(campaignId, keywords, account, itemAllowance);
    }
}
