package com.edge.qms.event;

import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.RecordStatus;
import org.springframework.context.ApplicationEvent;

/**
 * 记录进入终审状态（APPROVED / REJECTED / CLOSED）时发布
 */
public class RecordFinalizedEvent extends ApplicationEvent {
    private final InspectionRecord record;
    private final RecordStatus previousStatus;

    public RecordFinalizedEvent(Object source, InspectionRecord record, RecordStatus previousStatus) {
        super(source);
        this.record = record;
        this.previousStatus = previousStatus;
    }

    public InspectionRecord getRecord() {
        return record;
    }

    public RecordStatus getPreviousStatus() {
        return previousStatus;
    }
}
