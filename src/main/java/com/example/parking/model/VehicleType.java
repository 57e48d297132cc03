package com.example.parking.model;

/**
 * Size class of a vehicle: COMPACT is a car, HEAVY a truck, LIGHT a bike.
 */
public enum VehicleType { COMPACT, HEAVY, LIGHT }
