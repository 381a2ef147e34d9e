package com.bpmnassistant.controller;

import com.bpmnassistant.controller.dto.CreateBpmnRequest;
import com.bpmnassistant.controller.dto.EditBpmnRequest;
import com.bpmnassistant.controller.dto.ErrorResponse;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.core.validation.SchemaViolationException;
import com.bpmnassistant.llm.FacadeException;
import com.bpmnassistant.llm.LLMFacadeFactory;
import com.bpmnassistant.orchestrator.BpmnModelingService;
import com.bpmnassistant.orchestrator.RetryBudgetExceededException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/bpmn")
public class BpmnController {

    private static final Logger log = LoggerFactory.getLogger(BpmnController.class);

    private final BpmnModelingService modelingService;
    private final LLMFacadeFactory    facadeFactory;
    private final ProcessValidator    processValidator;
    private final ProcessJsonCodec    codec;

    public BpmnController(
            BpmnModelingService modelingService,
            LLMFacadeFactory    facadeFactory,
            ProcessValidator    processValidator,
            ProcessJsonCodec    codec
    ) {
        this.modelingService  = modelingService;
        this.facadeFactory    = facadeFactory;
        this.processValidator = processValidator;
        this.codec            = codec;
    }

    @PostMapping("/create")
    public ResponseEntity<?> create(@RequestBody CreateBpmnRequest request) {
        if (request.getMessageHistory().isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("message_history must not be empty"));
        }

        ProcessTree process = modelingService.createBpmn(facadeFactory.create(), request.getMessageHistory());
        return ResponseEntity.ok(codec.wrap(process));
    }

    @PostMapping("/edit")
    public ResponseEntity<?> edit(@RequestBody EditBpmnRequest request) throws FacadeException {
        if (request.getMessageHistory().isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("message_history must not be empty"));
        }

        JsonNode processJson = request.getProcess();
        try {
            processValidator.validate(processJson);
        } catch (SchemaViolationException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid process: " + e.getMessage()));
        }

        ProcessTree edited = modelingService.editBpmn(
                facadeFactory.create(), codec.decode(processJson), request.getMessageHistory());
        return ResponseEntity.ok(codec.wrap(edited));
    }

    @ExceptionHandler(RetryBudgetExceededException.class)
    public ResponseEntity<ErrorResponse> onBudgetExceeded(RetryBudgetExceededException e) {
        log.warn("[API] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getMessage(), e.getBudget().name()));
    }

    @ExceptionHandler(FacadeException.class)
    public ResponseEntity<ErrorResponse> onFacadeFailure(FacadeException e) {
        log.warn("[API] Oracle unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of(e.getMessage()));
    }
}
