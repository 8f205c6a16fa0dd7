package com.cabinet.saas.infrastructure.tariff;

import jakarta.persistence.*;

@Entity
@Table(name = "tariffs")
public class TariffEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "family_enabled", nullable = false)
  private boolean familyEnabled;

  /** Includes the owner. */
  @Column(name = "family_max_members", nullable = false)
  private int familyMaxMembers;

  @Column(name = "device_limit", nullable = false)
  private int deviceLimit;

  protected TariffEntity() {}

  public TariffEntity(String name, boolean familyEnabled, int familyMaxMembers, int deviceLimit) {
    this.name = name;
    this.familyEnabled = familyEnabled;
    this.familyMaxMembers = familyMaxMembers;
    this.deviceLimit = deviceLimit;
  }

  public Long getId() { return id; }
  public String getName() { return name; }
  public boolean isFamilyEnabled() { return familyEnabled; }
  public int getFamilyMaxMembers() { return familyMaxMembers; }
  public int getDeviceLimit() { return deviceLimit; }

  public void setFamilyEnabled(boolean familyEnabled) { this.familyEnabled = familyEnabled; }
  public void setFamilyMaxMembers(int familyMaxMembers) { this.familyMaxMembers = familyMaxMembers; }
}
