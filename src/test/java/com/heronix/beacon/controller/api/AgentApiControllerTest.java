package com.heronix.beacon.controller.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.beacon.model.domain.Device;
import com.heronix.beacon.model.enums.DeviceStatus;
import com.heronix.beacon.repository.AgentCredentialRepository;
import com.heronix.beacon.repository.DeviceNetworkStateRepository;
import com.heronix.beacon.repository.DeviceRepository;
import com.heronix.beacon.service.AgentIdentityGuard;
import com.heronix.beacon.service.CredentialVault;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for the agent REST API
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AgentApiControllerTest {

    private static String heartbeat(String installationId) {
        return "{\"installationId\": \"" + installationId + "\", "
                + "\"hardwareAddress\": \"aa:bb:cc:dd:ee:01\", "
                + "\"hostname\": \"home-nas\", \"networkAddress\": \"192.168.1.10\"}";
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CredentialVault credentialVault;

    @Autowired
    private AgentIdentityGuard identityGuard;

    @Autowired
    private AgentCredentialRepository credentialRepository;

    @Autowired
    private DeviceRepository deviceRepository;

    @Autowired
    private DeviceNetworkStateRepository networkStateRepository;

    private Long credentialId;
    private String bearer;

    @BeforeEach
    void setUp() {
        networkStateRepository.deleteAll();
        deviceRepository.deleteAll();
        credentialRepository.deleteAll();

        var issued = credentialVault.issue("alice", "Home agent");
        credentialId = issued.credential().getId();
        bearer = "Bearer " + issued.plaintextSecret();
    }

    private Device storeDevice(String owner, String name, String hardwareAddress) {
        return deviceRepository.save(Device.builder()
                .ownerPrincipalId(owner)
                .name(name)
                .hardwareAddress(hardwareAddress)
                .status(DeviceStatus.ONLINE)
                .build());
    }

    @Test
    @DisplayName("Requests without a valid bearer token are rejected with 401")
    void testUnauthenticated() throws Exception {
        mockMvc.perform(put("/agent/devices/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid or missing agent credential"));

        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + "f".repeat(64))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid or missing agent credential"));

        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer short")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("A revoked token is rejected on the very next request")
    void testRevokedToken() throws Exception {
        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isOk());

        assertTrue(credentialVault.revoke(credentialId, "alice"));

        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": []}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Heartbeat walks through pending, ok and mismatch answers")
    void testHeartbeat() throws Exception {
        mockMvc.perform(post("/agent/heartbeat")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(heartbeat("inst-a")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending_approval"))
                .andExpect(jsonPath("$.serverTime").exists())
                .andExpect(jsonPath("$.message").isNotEmpty());

        identityGuard.approve(credentialId, "alice");

        mockMvc.perform(post("/agent/heartbeat")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(heartbeat("inst-a")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.message").doesNotExist());

        mockMvc.perform(post("/agent/heartbeat")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(heartbeat("inst-b")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("device_mismatch"))
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    @DisplayName("Heartbeat with missing identity fields is a 400 naming them")
    void testHeartbeatInvalid() throws Exception {
        mockMvc.perform(post("/agent/heartbeat")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hardwareAddress\": \"not-a-mac\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.installationId").exists())
                .andExpect(jsonPath("$.errors.hostname").exists())
                .andExpect(jsonPath("$.errors.hardwareAddress").exists());

        assertNull(credentialRepository.findById(credentialId).orElseThrow().getAgentInstallationId());
    }

    @Test
    @DisplayName("Register answers 201 for a new device and 200 for a known one")
    void testRegisterDevice() throws Exception {
        String body = "{\"name\": \"Printer\", \"hardwareAddress\": \"aa:bb:cc:00:00:01\"}";

        MvcResult created = mockMvc.perform(post("/agent/devices")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.hardwareAddress").value("AA:BB:CC:00:00:01"))
                .andExpect(jsonPath("$.status").value("online"))
                .andReturn();

        JsonNode json = objectMapper.readTree(created.getResponse().getContentAsString());
        long id = json.get("id").asLong();

        mockMvc.perform(post("/agent/devices")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));

        assertEquals(1, deviceRepository.count());
    }

    @Test
    @DisplayName("Patch writes only the fields present")
    void testPatchDevice() throws Exception {
        Device device = storeDevice("alice", "Printer", "AA:BB:CC:00:00:01");

        mockMvc.perform(patch("/agent/devices/{id}", device.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"away\", \"networkAddress\": \"192.168.1.77\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Printer"))
                .andExpect(jsonPath("$.status").value("away"));

        assertEquals("192.168.1.77",
                networkStateRepository.findByDeviceId(device.getId()).orElseThrow().getNetworkAddress());
    }

    @Test
    @DisplayName("Another owner's device is not found for patch and delete")
    void testForeignDevice() throws Exception {
        Device bobs = storeDevice("bob", "Bob's printer", "AA:BB:CC:00:00:01");

        mockMvc.perform(patch("/agent/devices/{id}", bobs.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"mine now\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Device not found"));

        mockMvc.perform(delete("/agent/devices/{id}", bobs.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNotFound());

        assertTrue(deviceRepository.existsById(bobs.getId()));
    }

    @Test
    @DisplayName("Delete removes an owned device")
    void testDeleteDevice() throws Exception {
        Device device = storeDevice("alice", "Printer", "AA:BB:CC:00:00:01");

        mockMvc.perform(delete("/agent/devices/{id}", device.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Device deleted successfully"));

        assertFalse(deviceRepository.existsById(device.getId()));
    }

    @Test
    @DisplayName("Sync returns the counts of the applied snapshot")
    void testSync() throws Exception {
        storeDevice("alice", "Printer", "AA:BB:CC:00:00:01");
        storeDevice("alice", "Old phone", "AA:BB:CC:00:00:02");

        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": ["
                                + "{\"name\": \"Printer\", \"hardwareAddress\": \"AA:BB:CC:00:00:01\", \"status\": \"offline\"},"
                                + "{\"name\": \"Laptop\", \"hardwareAddress\": \"AA:BB:CC:00:00:03\", \"status\": \"online\","
                                + " \"networkAddress\": \"fe80::1\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.deleted").value(1));

        assertEquals(2, deviceRepository.count());
    }

    @Test
    @DisplayName("Invalid snapshot is a 400 naming the offending entry and changes nothing")
    void testSyncInvalid() throws Exception {
        storeDevice("alice", "Printer", "AA:BB:CC:00:00:01");

        MvcResult result = mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": ["
                                + "{\"name\": \"Laptop\", \"hardwareAddress\": \"AA:BB:CC:00:00:03\", \"status\": \"online\"},"
                                + "{\"name\": \"Broken\", \"hardwareAddress\": \"zz:zz\", \"status\": \"online\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation error"))
                .andReturn();

        JsonNode errors = objectMapper.readTree(result.getResponse().getContentAsString()).get("errors");
        assertTrue(errors.has("devices[1].hardwareAddress"));
        assertFalse(errors.has("devices[0].hardwareAddress"));

        assertEquals(1, deviceRepository.count());
    }

    @Test
    @DisplayName("Malformed JSON is a 400")
    void testMalformedBody() throws Exception {
        mockMvc.perform(put("/agent/devices/sync")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"devices\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    @DisplayName("CORS preflight is answered without a token")
    void testPreflight() throws Exception {
        mockMvc.perform(options("/agent/heartbeat")
                        .header(HttpHeaders.ORIGIN, "https://agent.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Authorization, Content-Type"))
                .andExpect(status().isOk())
                .andExpect(header().exists(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }
}
