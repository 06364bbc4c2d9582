package org.fpbjs.amlmapper.web;

import org.fpbjs.amlmapper.FpbAmlConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversionController.class)
class ConversionControllerFailureTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FpbAmlConversionService conversionService;

    @Test
    void shouldAnswerBadRequestForUnexpectedFailure() throws Exception {
        when(conversionService.toAml(anyString())).thenThrow(new IllegalStateException("Unsupported node"));

        mockMvc.perform(post("/api/to-aml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported node"));
    }

    @Test
    void shouldFallBackToExceptionNameWithoutMessage() throws Exception {
        when(conversionService.toJson(anyString())).thenThrow(new UnsupportedOperationException());

        mockMvc.perform(post("/api/to-json")
                        .contentType(MediaType.APPLICATION_XML)
                        .content("<CAEXFile/>"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UnsupportedOperationException"));
    }
}
