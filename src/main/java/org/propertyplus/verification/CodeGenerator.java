package org.propertyplus.verification;

@FunctionalInterface
public interface CodeGenerator {

    String generate();
}
