package com.carrental.rental.service;

import com.carrental.rental.access.Actor;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.exception.AccessDeniedException;
import com.carrental.rental.exception.RentalValidationException;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.exception.VehicleInUseException;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.repository.MaintenanceWindowRepository;
import com.carrental.rental.repository.VehicleRepository;
import com.carrental.rental.util.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("FleetService Unit Tests")
class FleetServiceTest {

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private MaintenanceWindowRepository maintenanceRepository;

    @Mock
    private AvailabilityCacheService cacheService;

    private FleetService fleetService;

    private final Actor admin = Actor.admin(1L);
    private final Actor customer = Actor.customer(2L);

    private VehicleEntry validEntry;
    private Vehicle existingVehicle;

    @BeforeEach
    void setUp() {
        fleetService = new FleetService(vehicleRepository, bookingRepository, maintenanceRepository, cacheService);

        validEntry = VehicleEntry.builder()
                .make("Toyota")
                .model("Corolla")
                .year(2021)
                .color("White")
                .mileage(32000)
                .dailyRate(new BigDecimal("45.00"))
                .build();

        existingVehicle = Vehicle.builder()
                .id(10L)
                .make("Toyota")
                .model("Corolla")
                .year(2021)
                .color("White")
                .mileage(32000)
                .dailyRate(new BigDecimal("45.00"))
                .build();

        when(vehicleRepository.save(any(Vehicle.class))).thenAnswer(inv -> {
            Vehicle v = inv.getArgument(0);
            if (v.getId() == null) {
                v.setId(10L);
            }
            return v;
        });
        when(vehicleRepository.findById(10L)).thenReturn(Optional.of(existingVehicle));
        when(vehicleRepository.findById(99L)).thenReturn(Optional.empty());
    }

    @Nested
    @DisplayName("Create Vehicle Tests")
    class CreateVehicleTests {

        @Test
        @DisplayName("Should apply rental-day defaults and invalidate the cache")
        void createVehicle_Defaults_Applied() {
            VehicleEntry created = fleetService.createVehicle(admin, validEntry);

            assertThat(created.getId()).isEqualTo(10L);
            assertThat(created.getMinRentDays()).isEqualTo(1);
            assertThat(created.getMaxRentDays()).isEqualTo(30);
            assertThat(created.getAvailableNow()).isTrue();
            verify(cacheService).invalidate();
        }

        @Test
        @DisplayName("Should reject customers")
        void createVehicle_Customer_Forbidden() {
            assertThatThrownBy(() -> fleetService.createVehicle(customer, validEntry))
                    .isInstanceOf(AccessDeniedException.class);
            verify(vehicleRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject non-positive rate")
        void createVehicle_ZeroRate_Throws() {
            validEntry.setDailyRate(BigDecimal.ZERO);

            assertThatThrownBy(() -> fleetService.createVehicle(admin, validEntry))
                    .isInstanceOf(RentalValidationException.class)
                    .hasMessageContaining("Daily rate");
        }

        @Test
        @DisplayName("Should reject max days below min days")
        void createVehicle_InvertedRentDays_Throws() {
            validEntry.setMinRentDays(5);
            validEntry.setMaxRentDays(3);

            assertThatThrownBy(() -> fleetService.createVehicle(admin, validEntry))
                    .isInstanceOf(RentalValidationException.class);
        }

        @Test
        @DisplayName("Should reject negative mileage")
        void createVehicle_NegativeMileage_Throws() {
            validEntry.setMileage(-1);

            assertThatThrownBy(() -> fleetService.createVehicle(admin, validEntry))
                    .isInstanceOf(RentalValidationException.class);
        }
    }

    @Nested
    @DisplayName("Update Vehicle Tests")
    class UpdateVehicleTests {

        @Test
        @DisplayName("Should apply only supplied fields")
        void updateVehicle_PartialChanges() {
            VehicleEntry changes = VehicleEntry.builder().dailyRate(new BigDecimal("55.00")).build();

            VehicleEntry updated = fleetService.updateVehicle(admin, 10L, changes);

            assertThat(updated.getDailyRate()).isEqualByComparingTo("55.00");
            assertThat(updated.getMake()).isEqualTo("Toyota");
            verify(cacheService).invalidate();
        }

        @Test
        @DisplayName("Should throw NotFound for unknown vehicle")
        void updateVehicle_Unknown_Throws() {
            assertThatThrownBy(() -> fleetService.updateVehicle(admin, 99L, validEntry))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "VEHICLE_NOT_FOUND");
        }

        @Test
        @DisplayName("Should toggle the off-market flag")
        void setAvailability_TogglesFlag() {
            VehicleEntry updated = fleetService.setAvailability(admin, 10L, false);

            assertThat(updated.getAvailableNow()).isFalse();
            assertThat(existingVehicle.getAvailableNow()).isFalse();
            verify(cacheService).invalidate();
        }
    }

    @Nested
    @DisplayName("Delete Vehicle Tests")
    class DeleteVehicleTests {

        @Test
        @DisplayName("Should delete an unreferenced vehicle")
        void deleteVehicle_Unreferenced_Deletes() {
            fleetService.deleteVehicle(admin, 10L);

            verify(vehicleRepository).delete(existingVehicle);
            verify(cacheService).invalidate();
        }

        @Test
        @DisplayName("Should refuse when bookings reference the vehicle")
        void deleteVehicle_WithBookings_Throws() {
            when(bookingRepository.existsByVehicle_Id(10L)).thenReturn(true);

            assertThatThrownBy(() -> fleetService.deleteVehicle(admin, 10L))
                    .isInstanceOf(VehicleInUseException.class);
            verify(vehicleRepository, never()).delete(any(Vehicle.class));
        }

        @Test
        @DisplayName("Should refuse when maintenance references the vehicle")
        void deleteVehicle_WithMaintenance_Throws() {
            when(maintenanceRepository.existsByVehicle_Id(10L)).thenReturn(true);

            assertThatThrownBy(() -> fleetService.deleteVehicle(admin, 10L))
                    .isInstanceOf(VehicleInUseException.class);
        }
    }

    @Nested
    @DisplayName("Query Tests")
    class QueryTests {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("Candidates are ordered by id")
        void candidatesFor_OrderedById() {
            when(vehicleRepository.findAll(any(Specification.class), any(Sort.class)))
                    .thenReturn(List.of(existingVehicle));

            List<Vehicle> candidates = fleetService.candidatesFor(
                    DateRange.of(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 4)), VehicleFilterCriteria.none());

            ArgumentCaptor<Sort> sortCaptor = ArgumentCaptor.forClass(Sort.class);
            verify(vehicleRepository).findAll(any(Specification.class), sortCaptor.capture());
            assertThat(sortCaptor.getValue().getOrderFor("id")).isNotNull();
            assertThat(candidates).containsExactly(existingVehicle);
        }

        @Test
        @DisplayName("Customers may view the fleet")
        void getVehicle_Customer_Allowed() {
            assertThat(fleetService.getVehicle(customer, 10L).getModel()).isEqualTo("Corolla");
        }

        @Test
        @DisplayName("Default listing order is year desc, make, model")
        void defaultListingOrder() {
            Sort sort = FleetService.DEFAULT_LISTING_ORDER;

            assertThat(sort.getOrderFor("year").getDirection()).isEqualTo(Sort.Direction.DESC);
            assertThat(sort.getOrderFor("make").getDirection()).isEqualTo(Sort.Direction.ASC);
            assertThat(sort.getOrderFor("model").getDirection()).isEqualTo(Sort.Direction.ASC);
        }
    }
}
