package com.oilresource.oil.service;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {
  public ResourceNotFoundException(UUID id) {
    super("Oil resource with ID " + id + " not found");
  }
}
