package tech.footprint.breach_api.service;

public class BreachNotFoundException extends RuntimeException {

    public BreachNotFoundException(String name) {
        super("Breach not found: " + name);
    }
}
