package com.example.agentpayments.store;

public enum StorageBackend {
    MONGO,
    FILE
}
