package com.cdcportal.backend.modules.access;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.auth.application.JwtTokenService;
import com.cdcportal.backend.modules.content.domain.Announcement;
import com.cdcportal.backend.modules.content.infrastructure.persistence.AnnouncementRepository;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantLocation;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantLocationRepository;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;
import com.cdcportal.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class ScopedAccessIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private TenantLocationRepository tenantLocationRepository;

    @Autowired
    private TenantRepository tenantRepository;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private StudentRepository studentRepository;

    @Autowired
    private GuardianInfoRepository guardianInfoRepository;

    @Autowired
    private AnnouncementRepository announcementRepository;

    private Tenant lian;
    private Tenant nasugbu;
    private UserAccount lianWorker;
    private UserAccount lianParent;
    private UserAccount nasugbuParent;
    private Student lianChild;
    private Student nasugbuChild;

    @BeforeEach
    void setUp() {
        lian = tenant("CDC Bagong Pook", "Lian", "Bagong Pook");
        nasugbu = tenant("CDC Wawa", "Nasugbu", "Wawa");
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        lianWorker = user("it.worker.lian", UserRoleType.WORKER, lian);
        lianChild = studentRepository.save(new Student("Ana", null, "Reyes", today.minusYears(4).minusMonths(2),
                "F", lian));
        nasugbuChild = studentRepository.save(new Student("Ben", null, "Cruz", today.minusYears(3).minusMonths(1),
                "M", nasugbu));
        lianParent = parentOf(lianChild, "it.parent.lian");
        nasugbuParent = parentOf(nasugbuChild, "it.parent.nasugbu");
    }

    @Test
    @DisplayName("requests without a token are answered 401")
    void unauthenticatedRequestsAreRejected() throws Exception {
        mockMvc.perform(get("/students"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("a token that fails verification is answered 401 INVALID_TOKEN")
    void tamperedTokenIsRejected() throws Exception {
        mockMvc.perform(get("/students").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"))
                .andExpect(jsonPath("$.type").value("urn:cdc-portal:problem:invalid-token"));
    }

    @Test
    @DisplayName("a worker lists only their own CDC's children with the canonical band")
    void workerListsOwnTenant() throws Exception {
        mockMvc.perform(get("/students").header(HttpHeaders.AUTHORIZATION, bearer(lianWorker)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(lianChild.getId()))
                .andExpect(jsonPath("$[0].ageBand").value("4-5"))
                .andExpect(jsonPath("$[0].totalMonths").value(50));
    }

    @Test
    @DisplayName("foreign and missing students are refused with the same body")
    void crossTenantAndMissingLookLikeEachOther() throws Exception {
        mockMvc.perform(get("/students/{id}", nasugbuChild.getId()).header(HttpHeaders.AUTHORIZATION, bearer(lianWorker)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"))
                .andExpect(jsonPath("$.detail").value("Not authorized"));
        mockMvc.perform(get("/students/{id}", Long.MAX_VALUE).header(HttpHeaders.AUTHORIZATION, bearer(lianWorker)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"))
                .andExpect(jsonPath("$.detail").value("Not authorized"));
    }

    @Test
    @DisplayName("a token whose tenant no longer matches the account is refused")
    void staleTenantClaimIsRefused() throws Exception {
        String staleToken = jwtTokenService.issueAccessToken(lianWorker.getId(), lianWorker.getUsername(),
                UserRoleType.WORKER.code(), nasugbu.getId());

        mockMvc.perform(get("/students").header(HttpHeaders.AUTHORIZATION, "Bearer " + staleToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));
    }

    @Test
    @DisplayName("an announcement for 4-5 year olds reaches the matching parent only")
    void announcementReachesMatchingParent() throws Exception {
        Map<String, Object> body = Map.of(
                "title", "Parents' meeting",
                "message", "Friday 3 PM",
                "ageFilter", "4-5",
                "roleFilter", List.of("parent"));

        mockMvc.perform(post("/announcements")
                        .header(HttpHeaders.AUTHORIZATION, bearer(lianWorker))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.cdcId").value(lian.getId()))
                .andExpect(jsonPath("$.roleFilter", contains("parent")));

        mockMvc.perform(get("/announcements/feed").header(HttpHeaders.AUTHORIZATION, bearer(lianParent)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].title", hasItem("Parents' meeting")));
        mockMvc.perform(get("/announcements/feed").header(HttpHeaders.AUTHORIZATION, bearer(nasugbuParent)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].title", not(hasItem("Parents' meeting"))));
    }

    @Test
    @DisplayName("a deactivated CDC drops out of the directory, the focal feed and the dashboards")
    void deactivatedTenantDisappearsFromGeographyReads() throws Exception {
        UserAccount admin = user("it.admin", UserRoleType.ADMIN, nasugbu);
        UserAccount msw = user("it.msw", UserRoleType.MSW, null);
        UserAccount focal = user("it.focal.lian", UserRoleType.FOCAL, null);
        focal.setAddress("Bagong Pook, Lian, Batangas");
        userAccountRepository.save(focal);
        announcementRepository.save(new Announcement("Lian focal notice", "Barangay visit", lianWorker, "all",
                EnumSet.of(UserRoleType.FOCAL), lian));
        int lianId = lian.getId().intValue();

        mockMvc.perform(get("/cdcs").param("municipality", "Lian").header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].id", hasItem(lianId)));
        mockMvc.perform(get("/announcements/feed").header(HttpHeaders.AUTHORIZATION, bearer(focal)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].title", hasItem("Lian focal notice")));
        mockMvc.perform(get("/dashboard/cdc-distribution").header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].cdcId", hasItem(lianId)));
        mockMvc.perform(get("/dashboard/age-distribution").param("municipality", "Lian")
                        .header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1));

        mockMvc.perform(post("/cdcs/{id}/deactivate", lian.getId()).header(HttpHeaders.AUTHORIZATION, bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEACTIVATED"));

        mockMvc.perform(get("/cdcs").param("municipality", "Lian").header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].id", not(hasItem(lianId))));
        mockMvc.perform(get("/announcements/feed").header(HttpHeaders.AUTHORIZATION, bearer(focal)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].title", not(hasItem("Lian focal notice"))));
        mockMvc.perform(get("/dashboard/cdc-distribution").header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].cdcId", not(hasItem(lianId))))
                .andExpect(jsonPath("$.items[*].cdcId", hasItem(nasugbu.getId().intValue())));
        mockMvc.perform(get("/dashboard/age-distribution").param("municipality", "Lian")
                        .header(HttpHeaders.AUTHORIZATION, bearer(msw)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    @DisplayName("a parent may not publish")
    void parentCannotPublish() throws Exception {
        Map<String, Object> body = Map.of(
                "title", "Hello",
                "message", "World",
                "roleFilter", List.of("parent"));

        mockMvc.perform(post("/announcements")
                        .header(HttpHeaders.AUTHORIZATION, bearer(lianParent))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("the age band catalog flags rows it cannot parse")
    void ageBandCatalog() throws Exception {
        mockMvc.perform(get("/age-bands").header(HttpHeaders.AUTHORIZATION, bearer(lianWorker)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)))
                .andExpect(jsonPath("$[0].minMonths").value(37))
                .andExpect(jsonPath("$[0].maxMonths").value(48))
                .andExpect(jsonPath("$[1].minMonths").value(49))
                .andExpect(jsonPath("$[2].maxMonths").value(71))
                .andExpect(jsonPath("$[3].parsed").value(false));
    }

    private Tenant tenant(String name, String municipality, String barangay) {
        TenantLocation location = tenantLocationRepository.save(
                new TenantLocation("IV-A", "Batangas", municipality, barangay));
        return tenantRepository.save(new Tenant(name, location));
    }

    private UserAccount user(String username, UserRoleType role, Tenant tenant) {
        UserAccount account = new UserAccount(username, "{noop}unused", username, role);
        account.setTenant(tenant);
        return userAccountRepository.save(account);
    }

    private UserAccount parentOf(Student child, String username) {
        UserAccount parent = user(username, UserRoleType.PARENT, null);
        GuardianInfo guardian = new GuardianInfo(child, username);
        guardian.setGuardianUser(parent);
        guardianInfoRepository.save(guardian);
        return parent;
    }

    private String bearer(UserAccount account) {
        return "Bearer " + jwtTokenService.issueAccessToken(account.getId(), account.getUsername(),
                account.getRole().code(), account.getTenantId());
    }
}
