package com.trackit.tracking.api;

public class PackageNotFoundException extends RuntimeException {

  public PackageNotFoundException(String packageId) {
    super("package not found: " + packageId);
  }
}
