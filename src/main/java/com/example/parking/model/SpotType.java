package com.example.parking.model;

public enum SpotType {
    LARGE, REGULAR, XLARGE, HANDICAPPED;

    /**
     * Fixed compatibility table. Every (vehicle, spot) pair is listed so that a new
     * constant on either side fails compilation here instead of silently defaulting.
     */
    public boolean accepts(VehicleType vehicleType) {
        return switch (vehicleType) {
            case COMPACT -> switch (this) {
                case REGULAR, LARGE, XLARGE -> true;
                case HANDICAPPED -> false;
            };
            case HEAVY -> switch (this) {
                case LARGE, XLARGE -> true;
                case REGULAR, HANDICAPPED -> false;
            };
            case LIGHT -> switch (this) {
                case REGULAR, LARGE, XLARGE -> true;
                case HANDICAPPED -> false;
            };
        };
    }
}
