package com.example.docx2md.controller;

import com.example.docx2md.service.math.OmmlTreeReader;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FormulaControllerTest {

    private static final String M = "xmlns:m=\"" + OmmlTreeReader.MATH_NS + "\"";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void convertsSingleFormula() throws Exception {
        String omml = "<m:oMath " + M + "><m:f><m:num><m:r><m:t>a</m:t></m:r></m:num>"
                + "<m:den><m:r><m:t>b</m:t></m:r></m:den></m:f></m:oMath>";

        mockMvc.perform(post("/api/formulas/latex").contentType(MediaType.APPLICATION_XML).content(omml))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].latex").value("\\frac{a}{b}"))
                .andExpect(jsonPath("$[0].display").value(false))
                .andExpect(jsonPath("$[0].markdown").value("$ \\frac{a}{b} $"));
    }

    @Test
    void convertsEveryFormulaOfAParagraph() throws Exception {
        String omml = "<m:oMathPara " + M + ">"
                + "<m:oMath><m:r><m:t>x</m:t></m:r></m:oMath>"
                + "<m:oMath><m:m><m:mr><m:e><m:r><m:t>1</m:t></m:r></m:e></m:mr></m:m></m:oMath>"
                + "</m:oMathPara>";

        mockMvc.perform(post("/api/formulas/latex").contentType(MediaType.APPLICATION_XML).content(omml))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].latex").value("x"))
                .andExpect(jsonPath("$[1].display").value(true));
    }

    @Test
    void rejectsMalformedXml() throws Exception {
        mockMvc.perform(post("/api/formulas/latex").contentType(MediaType.APPLICATION_XML).content("<m:oMath"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }
}
