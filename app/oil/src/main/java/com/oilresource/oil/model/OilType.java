package com.oilresource.oil.model;

public enum OilType {
  PETROL,
  DIESEL,
  GAS
}
