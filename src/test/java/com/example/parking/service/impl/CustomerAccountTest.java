package com.example.parking.service.impl;

import com.example.parking.model.Vehicle;
import com.example.parking.model.VehicleType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerAccountTest {

    private final Vehicle car = new Vehicle(VehicleType.COMPACT, "Toyota", "ABC123");
    private final Vehicle truck = new Vehicle(VehicleType.HEAVY, "Mac", "XYZ789");

    @Test
    void shouldRegisterUnderSequentialIds() {
        CustomerAccount account = new CustomerAccount("Larry", "123");

        assertThat(account.registerVehicle(car)).isEqualTo("veh_1");
        assertThat(account.registerVehicle(truck)).isEqualTo("veh_2");
        assertThat(account.getVehicleById("veh_2")).contains(truck);
        assertThat(account.getVehicleById("veh_3")).isEmpty();
    }

    @Test
    void removedVehicleIsGoneAndIdIsNotReused() {
        CustomerAccount account = new CustomerAccount("Larry", "123");
        account.registerVehicle(car);
        account.registerVehicle(truck);

        account.removeVehicle(car);

        assertThat(account.getVehicleById("veh_1")).isEmpty();
        assertThat(account.getVehicles()).containsExactly(truck);
        assertThat(account.registerVehicle(car)).isEqualTo("veh_3");
    }
}
