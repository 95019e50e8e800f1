package com.example.orderly.model;

/** 来訪者が任意で残す連絡情報。すべて null 可。 */
public record VisitorDetails(String name, String phone, String notes) {

  private static final VisitorDetails ANONYMOUS = new VisitorDetails(null, null, null);

  public static VisitorDetails anonymous() {
    return ANONYMOUS;
  }
}
