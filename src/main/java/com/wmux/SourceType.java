package com.wmux;

public enum SourceType {
    IN_MEMORY,
    ETCD
}
