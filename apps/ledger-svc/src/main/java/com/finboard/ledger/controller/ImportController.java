package com.finboard.ledger.controller;

import com.finboard.ledger.controller.dto.TemplateResponseDto;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.imports.CsvImportService;
import com.finboard.ledger.imports.CsvTemplates;
import com.finboard.ledger.model.ImportResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/import")
public class ImportController {

    private final CsvImportService csvImportService;

    public ImportController(CsvImportService csvImportService) {
        this.csvImportService = csvImportService;
    }

    @PostMapping("/transactions/csv")
    public ResponseEntity<ImportResult> importTransactions(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(csvImportService.importTransactions(readCsv(file)));
    }

    @PostMapping("/accounts/csv")
    public ResponseEntity<ImportResult> importAccounts(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(csvImportService.importAccounts(readCsv(file)));
    }

    @PostMapping("/investments/csv")
    public ResponseEntity<ImportResult> importInvestments(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(csvImportService.importInvestments(readCsv(file)));
    }

    @GetMapping("/templates/{kind}")
    public ResponseEntity<TemplateResponseDto> template(@PathVariable("kind") String kind) {
        return ResponseEntity.ok(new TemplateResponseDto(CsvTemplates.forKind(kind)));
    }

    private static String readCsv(MultipartFile file) {
        CsvImportService.requireCsvFilename(file.getOriginalFilename());
        try {
            return new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ValidationException("Upload could not be read: " + ex.getMessage());
        }
    }
}
