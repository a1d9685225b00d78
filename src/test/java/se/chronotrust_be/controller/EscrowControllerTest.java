package se.chronotrust_be.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import se.chronotrust_be.dto.response.EscrowContractResponse;
import se.chronotrust_be.dto.response.OperationResult;
import se.chronotrust_be.exception.ErrorCode;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.enums.DeliveryParty;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.service.EscrowContractService;
import se.chronotrust_be.service.LifecycleFacade;
import se.chronotrust_be.service.SettlementService;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EscrowController.class)
@DisplayName("EscrowController Web Tests")
class EscrowControllerTest {

    private static final String OPEN_BODY = """
            {
              "watchId": 3,
              "buyerId": 100,
              "buyerChainKey": "GCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCCC",
              "sellerId": 200,
              "amount": 25000.00,
              "currency": "BRL",
              "deadline": "%s"
            }
            """.formatted(LocalDateTime.now().plusDays(7).withNano(0));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LifecycleFacade lifecycleFacade;

    @MockBean
    private EscrowContractService escrowContractService;

    @MockBean
    private SettlementService settlementService;

    @MockBean
    private LifecycleMapper mapper;

    @Test
    @DisplayName("Opening escrow answers 201 with the funded contract")
    void shouldCreateEscrow() throws Exception {
        when(lifecycleFacade.openEscrow(any())).thenReturn(OperationResult.success(EscrowContractResponse.builder()
                .contractId(7L)
                .watchId(3L)
                .state(EscrowState.FUNDED)
                .stateVersion(0L)
                .build()));

        mockMvc.perform(post("/api/v1/escrows").contentType(MediaType.APPLICATION_JSON).content(OPEN_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.contractId").value(7))
                .andExpect(jsonPath("$.data.state").value("FUNDED"));
    }

    @Test
    @DisplayName("A watch already in escrow answers 409 marked retryable")
    void shouldRenderConflict() throws Exception {
        when(lifecycleFacade.openEscrow(any()))
                .thenReturn(OperationResult.failure(ErrorCode.CONFLICT, "Watch 3 already has an active escrow contract"));

        mockMvc.perform(post("/api/v1/escrows").contentType(MediaType.APPLICATION_JSON).content(OPEN_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.metadata.code").value("CONFLICT"))
                .andExpect(jsonPath("$.metadata.retryable").value(true));
    }

    @Test
    @DisplayName("Missing fields are rejected before reaching the lifecycle")
    void shouldValidateRequest() throws Exception {
        mockMvc.perform(post("/api/v1/escrows").contentType(MediaType.APPLICATION_JSON).content("{\"amount\": 10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors").isArray());
        verifyNoInteractions(lifecycleFacade);
    }

    @Test
    @DisplayName("Resolving from the wrong state answers 422")
    void shouldRenderInvalidState() throws Exception {
        when(lifecycleFacade.resolve(7L))
                .thenReturn(OperationResult.failure(ErrorCode.INVALID_STATE, "Contract 7 cannot be resolved from FUNDED"));

        mockMvc.perform(post("/api/v1/escrows/7/resolve"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.metadata.code").value("INVALID_STATE"))
                .andExpect(jsonPath("$.metadata.retryable").value(false));
    }

    @Test
    @DisplayName("Unknown contract answers 404")
    void shouldRenderNotFound() throws Exception {
        when(escrowContractService.getContract(99L))
                .thenThrow(new ResourceNotFoundException("Escrow contract not found with ID: 99"));

        mockMvc.perform(get("/api/v1/escrows/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.metadata.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Seller delivery confirmation is passed to the lifecycle")
    void shouldConfirmDelivery() throws Exception {
        when(lifecycleFacade.confirmDelivery(7L, DeliveryParty.SELLER, 200L))
                .thenReturn(OperationResult.success(EscrowContractResponse.builder()
                        .contractId(7L)
                        .state(EscrowState.AWAITING_EVALUATION)
                        .sellerConfirmedAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                        .build()));

        mockMvc.perform(post("/api/v1/escrows/7/confirm-delivery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"party\": \"SELLER\", \"userId\": 200}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sellerConfirmedAt").exists());
        verify(lifecycleFacade).confirmDelivery(7L, DeliveryParty.SELLER, 200L);
    }

    @Test
    @DisplayName("Delivery confirmation without a party is rejected")
    void shouldValidateDeliveryConfirmation() throws Exception {
        mockMvc.perform(post("/api/v1/escrows/7/confirm-delivery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": 200}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(lifecycleFacade);
    }

    @Test
    @DisplayName("Active contract of a watch is returned")
    void shouldReturnActiveContract() throws Exception {
        EscrowContract active = EscrowContract.builder().contractId(7L).watchId(3L).build();
        when(escrowContractService.findActiveForWatch(3L)).thenReturn(Optional.of(active));
        when(mapper.toContractResponse(active)).thenReturn(EscrowContractResponse.builder()
                .contractId(7L)
                .watchId(3L)
                .state(EscrowState.FUNDED)
                .build());

        mockMvc.perform(get("/api/v1/escrows/active").param("watchId", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.contractId").value(7));
    }

    @Test
    @DisplayName("Watch without an active contract answers 404")
    void shouldRenderMissingActiveContract() throws Exception {
        when(escrowContractService.findActiveForWatch(3L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/escrows/active").param("watchId", "3"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.metadata.code").value("NOT_FOUND"));
    }
}
