package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;

import java.util.List;

@FunctionalInterface
public interface SilverTable<T extends CleanRecord> {

    void saveAll(List<T> records);
}
