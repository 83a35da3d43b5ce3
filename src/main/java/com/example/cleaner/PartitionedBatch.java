package com.example.cleaner;

import lombok.Value;

import java.util.List;

@Value
public class PartitionedBatch {
    int index;
    List<UserRecord> valid;
    List<ValidatedRecord> garbage;
}
