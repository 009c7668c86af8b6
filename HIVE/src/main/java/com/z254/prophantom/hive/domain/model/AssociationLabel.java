package com.z254.prophantom.hive.domain.model;

public enum AssociationLabel {
    REMINDS_OF,
    CONTRADICTS,
    ELABORATES,
    SUMMARIZES
}
