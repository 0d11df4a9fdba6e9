package com.e2eq.relations.model;

import java.util.Date;

/**
 * Records carrying the audit columns stamped before inserts and updates.
 */
public interface Timestamped {
    Date getCreatedAt();

    void setCreatedAt(Date createdAt);

    Date getUpdatedAt();

    void setUpdatedAt(Date updatedAt);
}
