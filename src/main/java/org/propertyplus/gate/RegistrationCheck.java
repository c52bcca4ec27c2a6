package org.propertyplus.gate;

@FunctionalInterface
public interface RegistrationCheck {

    boolean isRegistered(String email);
}
