package com.glengine.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller identity carried through every validation call. Never persisted here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostingContext {

    private String tenantId;
    private String companyId;
    private String userId;
    private String userRole;
}
