package com.merchandise.inventory.entity;

public enum PriceType {
    PURCHASE,
    RETAIL
}
