package com.patientregistry.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("PatientController")
class PatientControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static String patientJson(String name) {
        return """
            {"name": "%s", "age": 30, "gender": "F", "medicalRecords": []}
            """.formatted(name);
    }

    private static String recordJson(String id, String diagnosis) {
        return """
            {"id": "%s", "patientId": "p", "diagnosis": "%s", "treatment": "Rest", "date": "2024-01-15T10:00:00Z"}
            """.formatted(id, diagnosis);
    }

    private String createPatient(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/patients")
                .contentType(MediaType.APPLICATION_JSON)
                .content(patientJson(name)))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asText();
    }

    @Nested
    @DisplayName("patients")
    class Patients {

        @Test
        @DisplayName("POST should create a patient that is not admitted")
        void shouldCreatePatient() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(patientJson("Ann")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isString())
                .andExpect(jsonPath("$.name").value("Ann"))
                .andExpect(jsonPath("$.isAdmitted").value(false))
                .andExpect(jsonPath("$.admittedAt").doesNotExist())
                .andExpect(jsonPath("$.dischargedAt").doesNotExist())
                .andExpect(jsonPath("$.medicalRecords", hasSize(0)));
        }

        @Test
        @DisplayName("POST should reject a payload without required fields")
        void shouldRejectIncompletePayload() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"Ann\", \"age\": 0, \"gender\": \"F\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required fields in the patient object"));
        }

        @Test
        @DisplayName("POST should reject a null medical record and store nothing")
        void shouldRejectNullMedicalRecord() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"Nullrecord\", \"age\": 30, \"gender\": \"F\", \"medicalRecords\": [null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").isString());

            mockMvc.perform(get("/api/patients").param("search", "Nullrecord"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("POST should reject a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post("/api/patients")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
        }

        @Test
        @DisplayName("GET by id should return the patient or 404")
        void shouldGetPatientById() throws Exception {
            String id = createPatient("Gretchen");

            mockMvc.perform(get("/api/patients/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Gretchen"));

            mockMvc.perform(get("/api/patients/{id}", "unknown-id"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Patient with id=unknown-id not found"));
        }

        @Test
        @DisplayName("search should match names case-insensitively")
        void shouldSearchByName() throws Exception {
            String marker = "zq" + UUID.randomUUID().toString().substring(0, 8);
            createPatient("Alpha " + marker);
            createPatient("Beta " + marker.toUpperCase());
            createPatient("Gamma");

            mockMvc.perform(get("/api/patients").param("search", marker.toUpperCase()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].name", containsInAnyOrder("Alpha " + marker, "Beta " + marker.toUpperCase())));

            mockMvc.perform(get("/api/patients/search").param("query", marker))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
        }

        @Test
        @DisplayName("PUT should update fields and keep the id")
        void shouldUpdatePatient() throws Exception {
            String id = createPatient("Hanna");

            mockMvc.perform(put("/api/patients/{id}", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"Hanna Berg\", \"age\": 41, \"gender\": \"F\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Hanna Berg"))
                .andExpect(jsonPath("$.age").value(41));

            mockMvc.perform(put("/api/patients/{id}", "ghost")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(patientJson("Nobody")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Patient with id=ghost does not exist"));
        }

        @Test
        @DisplayName("DELETE should return the removed patient and reject malformed ids")
        void shouldDeletePatient() throws Exception {
            String id = createPatient("Ivo");

            mockMvc.perform(delete("/api/patients/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid patient ID"));

            mockMvc.perform(delete("/api/patients/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Ivo"));

            mockMvc.perform(get("/api/patients/{id}", id))
                .andExpect(status().isNotFound());

            mockMvc.perform(delete("/api/patients/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Patient with ID " + id + " does not exist"));
        }
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        @DisplayName("should admit, refuse a second admission and discharge")
        void shouldFollowAdmissionScenario() throws Exception {
            String id = createPatient("Ann");

            mockMvc.perform(post("/api/patients/{id}/admit", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isAdmitted").value(true))
                .andExpect(jsonPath("$.admittedAt").isString());

            mockMvc.perform(post("/api/patients/{id}/admit", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Patient with id=" + id + " is already admitted"));

            mockMvc.perform(post("/api/patients/{id}/discharge", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isAdmitted").value(false))
                .andExpect(jsonPath("$.dischargedAt").isString());

            mockMvc.perform(post("/api/patients/{id}/discharge", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Patient with id=" + id + " is not currently admitted"));
        }
    }

    @Nested
    @DisplayName("medical records")
    class MedicalRecords {

        @Test
        @DisplayName("should add, update, list and delete records")
        void shouldManageRecords() throws Exception {
            String id = createPatient("Jonas");

            mockMvc.perform(post("/api/patients/{id}/medical-records", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(recordJson("r-1", "Flu")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.medicalRecords", hasSize(1)))
                .andExpect(jsonPath("$.medicalRecords[0].date").value("2024-01-15T10:00:00Z"));

            mockMvc.perform(post("/api/patients/{id}/medical-records", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(recordJson("r-2", "Sprain")))
                .andExpect(status().isCreated());

            mockMvc.perform(put("/api/patients/{id}/medical-records/{recordId}", id, "r-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(recordJson("r-1", "Pneumonia")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.medicalRecords[0].diagnosis").value("Pneumonia"))
                .andExpect(jsonPath("$.medicalRecords[1].diagnosis").value("Sprain"));

            mockMvc.perform(delete("/api/patients/{id}/medical-records/{recordId}", id, "r-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.medicalRecords", hasSize(1)));

            mockMvc.perform(get("/api/patients/{id}/medical-records", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("r-1"));
        }

        @Test
        @DisplayName("should report unknown records")
        void shouldReportUnknownRecord() throws Exception {
            String id = createPatient("Karl");

            mockMvc.perform(delete("/api/patients/{id}/medical-records/{recordId}", id, "r-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error")
                    .value("Medical record with id=r-404 not found for patient with id=" + id));
        }

        @Test
        @DisplayName("should reject records without a diagnosis")
        void shouldRejectInvalidRecord() throws Exception {
            String id = createPatient("Lena");

            mockMvc.perform(post("/api/patients/{id}/medical-records", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"id\": \"r-1\", \"treatment\": \"Rest\", \"date\": \"2024-01-15T10:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Diagnosis is required"));
        }
    }

    @Nested
    @DisplayName("operations")
    class Operations {

        @Test
        @DisplayName("should list every operation with its kind")
        void shouldListOperations() throws Exception {
            mockMvc.perform(get("/api/patients/operations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(12)));

            mockMvc.perform(get("/api/patients/operations").param("kind", "query"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].name", containsInAnyOrder(
                    "getPatients", "getPatient", "searchPatients", "getMedicalRecords")));
        }

        @Test
        @DisplayName("should reject an unknown kind")
        void shouldRejectUnknownKind() throws Exception {
            mockMvc.perform(get("/api/patients/operations").param("kind", "sideways"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown OperationKind: sideways"));
        }
    }
}
