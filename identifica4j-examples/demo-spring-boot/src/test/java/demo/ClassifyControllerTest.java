/*
 * Copyright (c) 2025 Identifica4J Contributors
 * Licensed under the Apache License 2.0
 */
package demo;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ClassifyControllerTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void requesterNameIsPersonalData() throws Exception {
        mvc.perform(post("/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Requerente: Maria Santos\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("has_personal_data"))
                .andExpect(jsonPath("$.confidence").value(0.9))
                .andExpect(jsonPath("$.entities[0].reason").value("individualizing_role"))
                .andExpect(jsonPath("$.entities[0].role_kind").value("role_noun"));
    }

    @Test
    void verboseListsExcludedNames() throws Exception {
        mvc.perform(post("/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Hospital Dr. João Silva\", \"verbose\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("public"))
                .andExpect(jsonPath("$.excluded[0].reason").value("exclusion_context"))
                .andExpect(jsonPath("$.excluded[0].evidence").value("hospital"));
    }

    @Test
    void configuredExclusionTermApplies() throws Exception {
        mvc.perform(get("/classify").param("text", "Secretaria Maria Santos, e-mail de contato"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("public"));
    }

    @Test
    void missingTextIsBadRequest() throws Exception {
        mvc.perform(post("/classify").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void csvUploadAppendsColumns() throws Exception {
        var file = new MockMultipartFile(
                "file",
                "pedidos.csv",
                "text/csv",
                "id,texto\n1,João Silva solicitou acesso\n2,Rua Maria Santos\n".getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/classify/csv").file(file))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Personal-Data-Rows", "1"))
                .andExpect(content().string(startsWith(
                        "id,texto,intent,confidence,entity_count,has_personal_data_flag")));
    }

    @Test
    void csvWithUnknownColumnIsBadRequest() throws Exception {
        var file = new MockMultipartFile(
                "file", "pedidos.csv", "text/csv", "id,text\n1,x\n".getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/classify/csv").file(file)).andExpect(status().isBadRequest());
    }
}
