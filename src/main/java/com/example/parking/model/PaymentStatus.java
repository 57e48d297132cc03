package com.example.parking.model;

public enum PaymentStatus { PENDING, SUCCEEDED, FAILED }
