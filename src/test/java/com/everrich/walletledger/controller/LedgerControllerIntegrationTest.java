package com.everrich.walletledger.controller;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class LedgerControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    private void createWallet(String json) throws Exception {
        mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
                .andExpect(status().isCreated());
    }

    @Test
    void createWallet_usesDefaultCurrencyAndBooksStartingBalance() throws Exception {
        mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Main\",\"startingBalance\":250}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.currency").value("EUR"))
                .andExpect(jsonPath("$.balance").value(250.0))
                .andExpect(jsonPath("$.current").value(true))
                .andExpect(jsonPath("$.transactionCount").value(1));

        mockMvc.perform(get("/api/wallets/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Main"));
    }

    @Test
    void duplicateWallet_isBadRequest() throws Exception {
        createWallet("{\"name\":\"Main\"}");

        mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"MAIN\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Wallet 'MAIN' already exists"));
    }

    @Test
    void reservedWalletName_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"current\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Wallet name 'current' is reserved"));
    }

    @Test
    void unknownWallet_isNotFound() throws Exception {
        mockMvc.perform(get("/api/wallets/Ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Wallet not found: Ghost"));

        mockMvc.perform(get("/api/wallets/current"))
                .andExpect(status().isNotFound());
    }

    @Test
    void depositWallet_exposesInterestFigures() throws Exception {
        createWallet("{\"name\":\"Term\",\"walletType\":\"DEPOSIT\",\"startingBalance\":1000,"
                + "\"interestRate\":12,\"termMonths\":12,\"capitalization\":false}");

        mockMvc.perform(get("/api/wallets/Term/deposit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.principal").value(1000.0))
                .andExpect(jsonPath("$.totalInterest", closeTo(120.0, 1e-6)))
                .andExpect(jsonPath("$.maturityAmount", closeTo(1120.0, 1e-6)));

        mockMvc.perform(post("/api/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"NoRate\",\"walletType\":\"DEPOSIT\",\"termMonths\":12}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Interest rate is required for deposit wallets"));
    }

    @Test
    void transactionLifecycle_byPosition() throws Exception {
        createWallet("{\"name\":\"Main\"}");

        mockMvc.perform(post("/api/wallets/Main/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":40,\"type\":\"EXPENSE\",\"category\":\"Food\","
                        + "\"createdAt\":\"2024-05-01T09:30:00\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.signedAmount").value(-40.0));

        mockMvc.perform(put("/api/wallets/Main/transactions/position/1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":55}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(55.0));

        mockMvc.perform(get("/api/wallets/Main"))
                .andExpect(jsonPath("$.balance").value(-55.0));

        mockMvc.perform(delete("/api/wallets/Main/transactions/position/1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(delete("/api/wallets/Main/transactions/position/1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidAmount_isBadRequest() throws Exception {
        createWallet("{\"name\":\"Main\"}");

        mockMvc.perform(post("/api/wallets/Main/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":-3,\"type\":\"INCOME\",\"category\":\"Gift\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void transfer_andCascadeDelete() throws Exception {
        createWallet("{\"name\":\"Checking\",\"startingBalance\":500}");
        createWallet("{\"name\":\"Savings\"}");

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromWallet\":\"Checking\",\"toWallet\":\"Savings\",\"amount\":200}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$[0].balance").value(300.0))
                .andExpect(jsonPath("$[1].balance").value(200.0));

        mockMvc.perform(get("/api/wallets/Savings/transactions"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].transfer").value(true))
                .andExpect(jsonPath("$[0].category").value("Transfer"));

        mockMvc.perform(delete("/api/wallets/Savings/transactions/position/1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/wallets/Checking"))
                .andExpect(jsonPath("$.balance").value(500.0))
                .andExpect(jsonPath("$.transactionCount").value(1));
    }

    @Test
    void transferToSameWallet_isBadRequest() throws Exception {
        createWallet("{\"name\":\"Checking\",\"startingBalance\":500}");

        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromWallet\":\"Checking\",\"toWallet\":\"checking\",\"amount\":20}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Cannot transfer to the same wallet"));
    }

    @Test
    void filters_addListAndRemove() throws Exception {
        createWallet("{\"name\":\"Main\",\"startingBalance\":800}");
        mockMvc.perform(post("/api/wallets/Main/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":20,\"type\":\"EXPENSE\",\"category\":\"Food\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/wallets/Main/filters")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"AMOUNT\",\"preset\":\"1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].index").value(1))
                .andExpect(jsonPath("$[0].name").value("Amount: Large"));

        mockMvc.perform(get("/api/wallets/Main/transactions").param("filtered", "true"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].amount").value(800.0));

        mockMvc.perform(delete("/api/wallets/Main/filters/2"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/api/wallets/Main/filters/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void sortingAndPresets_areListed() throws Exception {
        createWallet("{\"name\":\"Main\"}");

        mockMvc.perform(put("/api/wallets/Main/transactions/sorting/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[2].active").value(true));

        mockMvc.perform(put("/api/wallets/sorting/9"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/filters/presets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date['1']").value("Today"))
                .andExpect(jsonPath("$.type['5']").value("Transfers Only"))
                .andExpect(jsonPath("$.amount['2']").value("Small amounts"));
    }
}
