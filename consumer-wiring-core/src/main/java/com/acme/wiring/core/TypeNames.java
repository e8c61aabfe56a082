package com.acme.wiring.core;

/** Display names for consumer types in logs and endpoint names. */
public final class TypeNames {

  private TypeNames() {}

  /** Simple name of the type, falling back to the binary name for anonymous classes. */
  public static String shortName(Class<?> type) {
    String simpleName = type.getSimpleName();
    if (simpleName.isEmpty()) {
      String name = type.getName();
      return name.substring(name.lastIndexOf('.') + 1);
    }
    return simpleName;
  }
}
