package com.lakehouse.churn.ingest;

public enum SourceFormat {
    CSV,
    JSON
}
