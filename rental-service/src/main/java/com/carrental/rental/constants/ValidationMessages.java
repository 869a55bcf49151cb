package com.carrental.rental.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Date Ranges ==========

    public static final String START_DATE_REQUIRED = "Start date is required";
    public static final String END_DATE_REQUIRED = "End date is required";
    public static final String END_AFTER_START = "End date must be after start date";
    public static final String RANGE_TOO_LONG = "Date range is too long";
    public static final String UNBOUNDED_DURATION = "An open-ended range has no duration";

    // ========== Vehicles ==========

    public static final String VEHICLE_DATA_REQUIRED = "Vehicle data is required";
    public static final String VEHICLE_ID_REQUIRED = "Vehicle ID is required";
    public static final String MAKE_REQUIRED = "Make is required";
    public static final String MODEL_REQUIRED = "Model is required";
    public static final String YEAR_REQUIRED = "Year is required";
    public static final String YEAR_MIN = "Year must be 1900 or later";
    public static final String COLOR_REQUIRED = "Color is required";
    public static final String MILEAGE_NON_NEGATIVE = "Mileage must be non-negative";
    public static final String DAILY_RATE_REQUIRED = "Daily rate is required";
    public static final String DAILY_RATE_POSITIVE = "Daily rate must be positive";
    public static final String MIN_RENT_DAYS_MIN = "Minimum rental days must be at least 1";
    public static final String MAX_RENT_DAYS_MIN = "Maximum rental days must be at least 1";
    public static final String RENT_DAYS_ORDER = "Maximum rental days cannot be less than minimum rental days";

    // ========== Maintenance ==========

    public static final String MAINTENANCE_TYPE_REQUIRED = "Maintenance type is required";
    public static final String COST_NON_NEGATIVE = "Cost must be non-negative";
    public static final String MAINTENANCE_END_BEFORE_START = "Maintenance end date cannot be before its start date";

    // ========== Bookings ==========

    public static final String BOOKING_REQUEST_REQUIRED = "Booking request is required";
    public static final String BOOKING_ID_REQUIRED = "Booking ID is required";
    public static final String CHARGE_CODE_REQUIRED = "Charge code is required";
    public static final String CHARGE_AMOUNT_REQUIRED = "Charge amount is required";
    public static final String CHARGE_AMOUNT_POSITIVE = "Charge amount must be positive";

    // ========== Actors ==========

    public static final String USER_ID_REQUIRED = "User ID is required";
}
