package com.flagship.member_ledger.lastschrift;

import com.flagship.member_ledger.lastschrift.dto.BatchReportResponse;
import com.flagship.member_ledger.lastschrift.dto.FinalizeTransactionsRequest;
import com.flagship.member_ledger.lastschrift.dto.GenerateTransactionsRequest;
import com.flagship.member_ledger.lastschrift.dto.TransactionResponse;
import com.flagship.member_ledger.lastschrift.sepa.SepaPainDocument;
import com.flagship.member_ledger.lastschrift.sepa.SepaPainService;
import com.flagship.member_ledger.ledger.FinanceActor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Direct debit transactions and the SEPA export.
 *
 * The export is a plain GET: it only reads open transactions, so downloading the
 * file twice is harmless.
 */
@RestController
@RequestMapping("/api/lastschrift/transactions")
@RequiredArgsConstructor
@Slf4j
public class LastschriftTransactionController {

    static final String EXCLUDED_HEADER = "X-Sepa-Excluded-Transactions";

    private final LastschriftTransactionService transactionService;
    private final SepaPainService sepaPainService;

    @PostMapping("/generate")
    public BatchReportResponse generate(@RequestBody(required = false) GenerateTransactionsRequest request,
                                        @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        List<Long> mandateIds = request != null ? request.getMandateIds() : null;
        return BatchReportResponse.from(
            transactionService.generateTransactions(mandateIds, FinanceActor.of(submittedBy)));
    }

    @PostMapping("/finalize")
    public BatchReportResponse finalizeTransactions(@Valid @RequestBody FinalizeTransactionsRequest request,
                                                    @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return BatchReportResponse.from(transactionService.finalizeTransactions(
            request.getTransactionIds(), request.getOutcome(), FinanceActor.of(submittedBy)));
    }

    @PostMapping("/{transactionId}/rollback")
    public TransactionResponse rollback(@PathVariable("transactionId") Long transactionId,
                                        @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return TransactionResponse.from(
            transactionService.rollbackTransaction(transactionId, FinanceActor.of(submittedBy)));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> get(@PathVariable("transactionId") Long transactionId) {
        return transactionService.findById(transactionId)
            .map(transaction -> ResponseEntity.ok(TransactionResponse.from(transaction)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<TransactionResponse> listOpen() {
        return transactionService.findOpen().stream().map(TransactionResponse::from).toList();
    }

    /**
     * pain.008 file of the open transactions, as an attachment. Ids of transactions
     * left out because of invalid data are listed in a response header. 204 when
     * nothing could be exported.
     */
    @GetMapping("/sepa-pain")
    public ResponseEntity<byte[]> downloadSepaPain(
            @RequestParam(value = "mandate_id", required = false) Long mandateId) {
        SepaPainDocument document = sepaPainService.createDocument(mandateId);
        String excluded = String.join(",", document.getExcluded().stream()
            .map(error -> error.getItemId().toString())
            .toList());
        if (document.isEmpty()) {
            log.info("No direct debits to export");
            return ResponseEntity.noContent().header(EXCLUDED_HEADER, excluded).build();
        }
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_XML)
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                .filename("sepa-pain-" + document.getMessageId() + ".xml")
                .build()
                .toString())
            .header(EXCLUDED_HEADER, excluded)
            .body(document.getXml().getBytes(StandardCharsets.UTF_8));
    }
}
