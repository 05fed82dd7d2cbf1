package com.example.AusFin;

import com.example.AusFin.config.FinanceConfig;
import com.example.AusFin.model.RuleTable;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.model.embedding=none",
                "spring.ai.openai.api-key=test",
                "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
                "spring.datasource.driver-class-name=org.h2.Driver",
                "spring.datasource.username=sa",
                "spring.datasource.password=",
                "spring.sql.init.mode=never"
        }
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(AusFinApplicationTests.TestAiConfiguration.class)
class AusFinApplicationTests {

    @Autowired
    private RuleTable ruleTable;

    @Autowired
    private FinanceConfig.Benchmark benchmark;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
        assertThat(ruleTable.version()).isEqualTo("AU-2024-25");
        assertThat(benchmark.cases()).isNotEmpty();
    }

    @Test
    void emergencyFundCalculatorEndpoint() throws Exception {
        mockMvc.perform(post("/api/calculator/emergency-fund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"age": 35, "annualIncome": 75000, "monthlyExpenses": 3000, "riskTolerance": "balanced"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("EMERGENCY_FUND"))
                .andExpect(jsonPath("$.ruleVersion").value("AU-2024-25"))
                .andExpect(jsonPath("$.fields.recommended_emergency_fund").value(18000.0));
    }

    @Test
    void riskProfileCalculatorEndpoint() throws Exception {
        mockMvc.perform(post("/api/calculator/risk-profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"age": 35, "annualIncome": 75000, "monthlyExpenses": 3000, "dependents": 0}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("RISK_PROFILE"))
                .andExpect(jsonPath("$.fields.risk_score").value(4))
                .andExpect(jsonPath("$.warnings[0]").value("Recommended risk tolerance: growth."));
    }

    @Test
    void invalidProfileIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/calculator/income-tax")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"age": -1, "annualIncome": 75000, "monthlyExpenses": 3000}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_profile"));
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        EmbeddingModel embeddingModel() {
            return Mockito.mock(EmbeddingModel.class);
        }

        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
