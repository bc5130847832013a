package com.leadgen.backend.services.campaign;

import com.leadgen.backend.models.CampaignCheckpoint;
import com.leadgen.backend.services.budget.BudgetAccount;
import com.leadgen.backend.services.budget.Denial;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory state of one campaign drive loop. Stop requests are read by the loop at unit
 * boundaries and by workers before each item admission.
 */
final class CampaignRun {

    enum StopRequest {
        PAUSE,
        CANCEL,
        BUDGET
    }

    private final Long campaignId;
    private final AtomicReference<StopRequest> stopRequest = new AtomicReference<>();
    private final AtomicReference<Denial> denial = new AtomicReference<>();

    // Guards checkpoint and campaign progress writes
    final Object progressLock = new Object();

    private volatile BudgetAccount account;
    private CampaignCheckpoint checkpoint;
    private int unitsProcessed;
    private int itemsDiscovered;

    CampaignRun(Long campaignId) {
        this.campaignId = campaignId;
    }

    Long getCampaignId() {
        return campaignId;
    }

    /**
     * Records a stop request. A budget stop wins over pause and cancel so the campaign ends
     * with the accurate reason; otherwise the first request wins.
     */
    void requestStop(StopRequest request) {
        if (request == StopRequest.BUDGET) {
            stopRequest.set(StopRequest.BUDGET);
        } else {
            stopRequest.compareAndSet(null, request);
        }
    }

    void budgetDenied(Denial budgetDenial) {
        denial.compareAndSet(null, budgetDenial);
        requestStop(StopRequest.BUDGET);
    }

    StopRequest getStopRequest() {
        return stopRequest.get();
    }

    boolean isStopRequested() {
        return stopRequest.get() != null;
    }

    Denial getDenial() {
        return denial.get();
    }

    BudgetAccount getAccount() {
        return account;
    }

    void setAccount(BudgetAccount account) {
        this.account = account;
    }

    // The fields below are guarded by progressLock

    CampaignCheckpoint getCheckpoint() {
        return checkpoint;
    }

    void setCheckpoint(CampaignCheckpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    int getUnitsProcessed() {
        return unitsProcessed;
    }

    void setUnitsProcessed(int unitsProcessed) {
        this.unitsProcessed = unitsProcessed;
    }

    int getItemsDiscovered() {
        return itemsDiscovered;
    }

    void setItemsDiscovered(int itemsDiscovered) {
        this.itemsDiscovered = itemsDiscovered;
    }
}
