package dev.tutordesk.student;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for {@link StudentService}, bound from {@code tutordesk.students.*}.
 *
 * <ul>
 *   <li>{@code active-status} - status value of enrolled students; list, find and filter return
 *       only these unless asked for everyone (default 在塾)
 *   <li>{@code id-prefix} - prefix of generated student ids (default s)
 *   <li>{@code find-limit} - default number of find candidates (default 10)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "tutordesk.students")
public class StudentProperties {

  private String activeStatus = "在塾";
  private String idPrefix = "s";
  private int findLimit = 10;

  @PostConstruct
  void validate() {
    if (activeStatus == null || activeStatus.isBlank()) {
      throw new IllegalStateException("tutordesk.students.active-status must not be blank");
    }
    if (idPrefix == null || idPrefix.isBlank()) {
      throw new IllegalStateException("tutordesk.students.id-prefix must not be blank");
    }
    if (findLimit < 1) {
      throw new IllegalStateException(
          "tutordesk.students.find-limit must be at least 1, got: " + findLimit);
    }
  }

  public String getActiveStatus() {
    return activeStatus;
  }

  public void setActiveStatus(String activeStatus) {
    this.activeStatus = activeStatus;
  }

  public String getIdPrefix() {
    return idPrefix;
  }

  public void setIdPrefix(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  public int getFindLimit() {
    return findLimit;
  }

  public void setFindLimit(int findLimit) {
    this.findLimit = findLimit;
  }
}
