package com.meshsos.routingbackend.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Vehicle leaving from and returning to a depot.
 * Capacity is carried as advisory metadata and is not enforced during routing.
 */
@Value
@AllArgsConstructor
public class Vehicle {

    public static final int DEFAULT_CAPACITY = 100;

    Location depot;
    int capacity;

    public Vehicle(Location depot) {
        this(depot, DEFAULT_CAPACITY);
    }
}
