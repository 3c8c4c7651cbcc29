package com.tony.powerRank.model;

public enum SampleFlag {
    OK,
    LOW_SAMPLE
}
