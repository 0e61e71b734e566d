package com.edge.qms.dto;

import com.edge.qms.model.RecordStatus;
import lombok.Data;

@Data
public class StatusChangeRequest {
    private RecordStatus status;
}
