package com.esplanada.api.rating;

public class SubjectNotFoundException extends RuntimeException {
    public SubjectNotFoundException(String message) { super(message); }
}
