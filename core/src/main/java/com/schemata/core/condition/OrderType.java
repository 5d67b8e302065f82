package com.schemata.core.condition;

public enum OrderType {
    ASC,
    DESC
}
