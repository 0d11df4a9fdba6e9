package com.e2eq.relations.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

@RegisterForReflection
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class TimestampedRecord implements Timestamped {
    protected Date createdAt;
    protected Date updatedAt;
}
