package com.esplanada.api.rating;

public class RatingNotFoundException extends RuntimeException {
    public RatingNotFoundException(String message) { super(message); }
}
