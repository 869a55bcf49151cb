package com.carrental.rental.constants;

public final class RentalConstants {

    private RentalConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Vehicle Defaults ==========

    public static final int DEFAULT_MIN_RENT_DAYS = 1;
    public static final int DEFAULT_MAX_RENT_DAYS = 30;
    public static final int MIN_VEHICLE_YEAR = 1900;

    // ========== Fees ==========

    public static final int FEE_SCALE = 2;

    // ========== Pagination ==========

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    // ========== Availability Cache ==========

    public static final int DEFAULT_CACHE_TTL_MINUTES = 10;
    public static final String REDIS_AVAILABILITY_PREFIX = "availability:";
    public static final String REDIS_GENERATION_KEY = "availability:generation";

    // ========== Request Headers ==========

    public static final String USER_ID_HEADER = "X-User-Id";
}
