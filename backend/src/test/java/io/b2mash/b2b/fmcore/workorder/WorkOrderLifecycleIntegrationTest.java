package io.b2mash.b2b.fmcore.workorder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.fmcore.TestcontainersConfiguration;
import io.b2mash.b2b.fmcore.assignment.Assignee;
import io.b2mash.b2b.fmcore.assignment.AssigneeRepository;
import io.b2mash.b2b.fmcore.assignment.AssigneeType;
import io.b2mash.b2b.fmcore.assignment.Availability;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WorkOrderLifecycleIntegrationTest {

  private static final String ORG_ID = "org_wo_lifecycle";
  private static final String OTHER_ORG_ID = "org_wo_other";
  private static final String STATS_ORG_ID = "org_wo_stats";
  private static final String TECHNICIAN_ID = "user_wo_tech";
  private static final String PARTNER_ORG_A = "org_wo_partner_a";
  private static final String PARTNER_ORG_B = "org_wo_partner_b";
  private static final String SHARED_VENDOR_ID = "vendor_wo_shared";

  @Autowired private MockMvc mockMvc;
  @Autowired private WorkOrderRepository workOrderRepository;
  @Autowired private AssigneeRepository assigneeRepository;
  @Autowired private SlaPolicy slaPolicy;

  @BeforeAll
  void seedAssignees() {
    assigneeRepository.save(
        new Assignee(
            TECHNICIAN_ID,
            ORG_ID,
            AssigneeType.USER,
            "Thandi Plumber",
            List.of("plumbing"),
            Availability.AVAILABLE,
            1,
            5,
            new BigDecimal("4.50")));
    assigneeRepository.save(
        new Assignee(
            "user_wo_offline",
            ORG_ID,
            AssigneeType.USER,
            "Off Duty",
            List.of("plumbing"),
            Availability.OFFLINE,
            0,
            10,
            new BigDecimal("5.00")));
    for (String tenantId : List.of(PARTNER_ORG_A, PARTNER_ORG_B)) {
      assigneeRepository.save(
          new Assignee(
              SHARED_VENDOR_ID,
              tenantId,
              AssigneeType.VENDOR,
              "Shared Plumbing Co",
              List.of("plumbing"),
              Availability.AVAILABLE,
              0,
              10,
              new BigDecimal("4.00")));
    }
  }

  @Test
  void shouldWalkFullLifecycleWithMediaAndAssignmentGuards() throws Exception {
    String id = seedWorkOrder(ORG_ID, Instant.now().plus(Duration.ofHours(24)));

    transition(id, managerJwt(), "ASSESSMENT")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ASSESSMENT"));

    mockMvc
        .perform(post("/api/work-orders/" + id + "/auto-assign").with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.routingMode").value("heuristic"))
        .andExpect(jsonPath("$.assignee.id").value(TECHNICIAN_ID));

    transition(id, technicianJwt(), "ESTIMATE_PENDING")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.required").value("BEFORE"));

    attach(id, technicianJwt(), "BEFORE")
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$[0].category").value("BEFORE"))
        .andExpect(jsonPath("$[0].uploadedBy").value(TECHNICIAN_ID));

    transition(id, technicianJwt(), "ESTIMATE_PENDING").andExpect(status().isOk());
    transition(id, technicianJwt(), "APPROVED").andExpect(status().isForbidden());
    transition(id, managerJwt(), "APPROVED").andExpect(status().isOk());
    transition(id, technicianJwt(), "IN_PROGRESS").andExpect(status().isOk());

    transition(id, technicianJwt(), "COMPLETED")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.required").value("AFTER"));

    attach(id, technicianJwt(), "AFTER").andExpect(status().isCreated());

    transition(id, technicianJwt(), "COMPLETED")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.completedAt", notNullValue()))
        .andExpect(jsonPath("$.attachments.length()").value(2));

    mockMvc
        .perform(get("/api/work-orders/" + id + "/timeline").with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(6))
        .andExpect(jsonPath("$[0].fromStatus").value("REPORTED"))
        .andExpect(jsonPath("$[0].toStatus").value("ASSESSMENT"))
        .andExpect(jsonPath("$[1].note").value("auto-assigned"))
        .andExpect(jsonPath("$[5].toStatus").value("COMPLETED"))
        .andExpect(jsonPath("$[5].actorId").value(TECHNICIAN_ID));

    transition(id, managerJwt(), "CANCELLED")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("terminal")));
  }

  @Test
  void shouldRejectStartWorkWithoutAssignee() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);
    transition(id, managerJwt(), "ASSESSMENT").andExpect(status().isOk());
    transition(id, managerJwt(), "ON_HOLD").andExpect(status().isOk());

    mockMvc
        .perform(get("/api/work-orders/" + id + "/transitions").with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].toStatus").value("ASSESSMENT"))
        .andExpect(jsonPath("$[0].action").value("resume"));

    transition(id, managerJwt(), "ASSESSMENT").andExpect(status().isOk());
  }

  @Test
  void shouldReturn404ForWorkOrderOfAnotherTenant() throws Exception {
    String id = seedWorkOrder(OTHER_ORG_ID, null);

    mockMvc
        .perform(get("/api/work-orders/" + id).with(managerJwt()))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/work-orders/" + UUID.randomUUID()).with(managerJwt()))
        .andExpect(status().isNotFound());
  }

  @Test
  void shouldReturn403WhenTargetingForeignTenant() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    mockMvc
        .perform(
            get("/api/work-orders/" + id).header("X-Tenant-Id", OTHER_ORG_ID).with(managerJwt()))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldLetSuperAdminReadAcrossTenants() throws Exception {
    String id = seedWorkOrder(OTHER_ORG_ID, null);

    mockMvc
        .perform(
            get("/api/work-orders/" + id)
                .with(
                    jwt()
                        .jwt(
                            j ->
                                j.subject("user_wo_root")
                                    .claim("o", Map.of("id", ORG_ID, "rol", "super_admin")))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tenantId").value(OTHER_ORG_ID));
  }

  @Test
  void shouldRejectResidentCancellation() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    transition(id, residentJwt(), "CANCELLED").andExpect(status().isForbidden());
    attach(id, residentJwt(), "OTHER").andExpect(status().isCreated());
  }

  @Test
  void shouldRejectTransitionWithoutTargetStatus() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    mockMvc
        .perform(
            post("/api/work-orders/" + id + "/transition")
                .with(managerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldRejectRequestsWithoutOrganizationRole() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    mockMvc
        .perform(get("/api/work-orders/" + id).with(jwt().jwt(j -> j.subject("user_wo_none"))))
        .andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/work-orders/" + id)).andExpect(status().isUnauthorized());
  }

  @Test
  void shouldEscalateOneLevel() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    mockMvc
        .perform(post("/api/work-orders/" + id + "/escalate").with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.priority").value("HIGH"))
        .andExpect(jsonPath("$.slaDueAt", notNullValue()));
  }

  @Test
  void shouldRecordEscalationReasonOnTimeline() throws Exception {
    String id = seedWorkOrder(ORG_ID, null);

    mockMvc
        .perform(
            post("/api/work-orders/" + id + "/escalate")
                .with(managerJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"priority": "CRITICAL", "reason": "resident reports sparks"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.priority").value("CRITICAL"))
        .andExpect(jsonPath("$.escalationCount").value(1));

    mockMvc
        .perform(get("/api/work-orders/" + id + "/timeline").with(managerJwt()))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$[0].note")
                .value("escalated from MEDIUM to CRITICAL: resident reports sparks"));
  }

  @Test
  void shouldDispatchVendorRegisteredWithTwoTenants() throws Exception {
    for (String tenantId : List.of(PARTNER_ORG_A, PARTNER_ORG_B)) {
      String id = seedWorkOrder(tenantId, null);
      var manager =
          jwt()
              .jwt(
                  j -> j.subject("user_wo_pm").claim("o", orgClaim(tenantId, "property_manager")));

      mockMvc
          .perform(
              post("/api/work-orders/" + id + "/assignment")
                  .with(manager)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"assigneeType": "VENDOR", "assigneeId": "%s"}
                      """
                          .formatted(SHARED_VENDOR_ID)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.assignment.assigneeId").value(SHARED_VENDOR_ID));

      mockMvc
          .perform(
              get("/api/work-orders/" + id)
                  .with(
                      jwt()
                          .jwt(
                              j ->
                                  j.subject(SHARED_VENDOR_ID)
                                      .claim("o", orgClaim(tenantId, "vendor")))))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.tenantId").value(tenantId));

      assertThat(assigneeRepository.findByIdAndTenantId(SHARED_VENDOR_ID, tenantId))
          .hasValueSatisfying(vendor -> assertThat(vendor.getCurrentWorkload()).isEqualTo(1));
    }
  }

  @Test
  void shouldAggregateStatsForTenant() throws Exception {
    seedWorkOrder(STATS_ORG_ID, Instant.now().minus(Duration.ofHours(2)));
    seedWorkOrder(STATS_ORG_ID, Instant.now().plus(Duration.ofHours(2)));

    mockMvc
        .perform(
            get("/api/work-orders/stats")
                .with(
                    jwt()
                        .jwt(
                            j ->
                                j.subject("user_wo_owner")
                                    .claim("o", orgClaim(STATS_ORG_ID, "corporate_owner")))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.statusCounts.REPORTED").value(2))
        .andExpect(jsonPath("$.overdueCount").value(1))
        .andExpect(jsonPath("$.avgCompletionHours").doesNotExist())
        .andExpect(jsonPath("$.slaComplianceRate").doesNotExist());
  }

  private String seedWorkOrder(String tenantId, Instant slaDueAt) {
    var workOrder =
        slaPolicy.open(
            tenantId,
            "Burst geyser",
            "Water leaking through ceiling",
            WorkOrderPriority.MEDIUM,
            List.of("plumbing"),
            slaDueAt,
            Instant.now().truncatedTo(ChronoUnit.MILLIS));
    return workOrderRepository.save(workOrder).getId().toString();
  }

  private ResultActions transition(String id, JwtRequestPostProcessor jwt, String toStatus)
      throws Exception {
    return mockMvc.perform(
        post("/api/work-orders/" + id + "/transition")
            .with(jwt)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"toStatus": "%s"}
                """
                    .formatted(toStatus)));
  }

  private ResultActions attach(String id, JwtRequestPostProcessor jwt, String category)
      throws Exception {
    return mockMvc.perform(
        post("/api/work-orders/" + id + "/attachments")
            .with(jwt)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"category": "%s", "url": "https://media.test/%s.jpg"}
                """
                    .formatted(category, UUID.randomUUID())));
  }

  private JwtRequestPostProcessor managerJwt() {
    return jwt()
        .jwt(
            j ->
                j.subject("user_wo_pm")
                    .claim("o", Map.of("id", ORG_ID, "rol", "property_manager")));
  }

  private JwtRequestPostProcessor technicianJwt() {
    return jwt()
        .jwt(j -> j.subject(TECHNICIAN_ID).claim("o", Map.of("id", ORG_ID, "rol", "technician")));
  }

  private JwtRequestPostProcessor residentJwt() {
    return jwt()
        .jwt(
            j ->
                j.subject("user_wo_resident").claim("o", Map.of("id", ORG_ID, "rol", "tenant")));
  }

  private static Map<String, Object> orgClaim(String orgId, String role) {
    return Map.of("id", orgId, "rol", role);
  }
}
