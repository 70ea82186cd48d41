package com.flagship.member_ledger.lastschrift.sepa;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a pain.008.001.02 (SEPA core direct debit initiation) document.
 *
 * One PmtInf block per sequence type, in FRST, RCUR order. NbOfTxs and CtrlSum of the
 * group header and of every block are computed from the items actually written.
 */
public class SepaPainWriter {

    public static final String NAMESPACE = "urn:iso:std:iso:20022:tech:xsd:pain.008.001.02";
    private static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String NOT_PROVIDED = "NOTPROVIDED";
    private static final DateTimeFormatter CREATION_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    public String write(String messageId, LocalDateTime createdAt, SepaCreditor creditor,
                        List<SepaDirectDebit> debits) {
        Map<SequenceType, List<SepaDirectDebit>> groups = new EnumMap<>(SequenceType.class);
        for (SequenceType type : SequenceType.values()) {
            List<SepaDirectDebit> group = debits.stream()
                .filter(debit -> debit.getSequenceType() == type)
                .toList();
            if (!group.isEmpty()) {
                groups.put(type, group);
            }
        }

        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("Document");
            xml.writeDefaultNamespace(NAMESPACE);
            xml.writeNamespace("xsi", XSI_NAMESPACE);
            xml.writeStartElement("CstmrDrctDbtInitn");

            xml.writeStartElement("GrpHdr");
            element(xml, "MsgId", messageId);
            element(xml, "CreDtTm", createdAt.format(CREATION_TIME));
            element(xml, "NbOfTxs", Integer.toString(debits.size()));
            element(xml, "CtrlSum", amount(controlSum(debits)));
            xml.writeStartElement("InitgPty");
            element(xml, "Nm", creditor.getName());
            xml.writeEndElement();
            xml.writeEndElement();

            for (Map.Entry<SequenceType, List<SepaDirectDebit>> group : groups.entrySet()) {
                writePaymentInformation(xml, messageId, creditor, group.getKey(), group.getValue());
            }

            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Could not render SEPA direct debit document " + messageId, e);
        }
        return out.toString();
    }

    public static BigDecimal controlSum(List<SepaDirectDebit> debits) {
        return debits.stream()
            .map(SepaDirectDebit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.UNNECESSARY);
    }

    private void writePaymentInformation(XMLStreamWriter xml, String messageId, SepaCreditor creditor,
                                         SequenceType type, List<SepaDirectDebit> debits)
            throws XMLStreamException {
        // the bank collects the whole block on one date, so take the latest requested one
        LocalDate collectionDate = debits.stream()
            .map(SepaDirectDebit::getCollectionDate)
            .max(Comparator.naturalOrder())
            .orElseThrow();

        xml.writeStartElement("PmtInf");
        element(xml, "PmtInfId", messageId + "-" + type.name());
        element(xml, "PmtMtd", "DD");
        element(xml, "BtchBookg", "true");
        element(xml, "NbOfTxs", Integer.toString(debits.size()));
        element(xml, "CtrlSum", amount(controlSum(debits)));

        xml.writeStartElement("PmtTpInf");
        xml.writeStartElement("SvcLvl");
        element(xml, "Cd", "SEPA");
        xml.writeEndElement();
        xml.writeStartElement("LclInstrm");
        element(xml, "Cd", "CORE");
        xml.writeEndElement();
        element(xml, "SeqTp", type.name());
        xml.writeEndElement();

        element(xml, "ReqdColltnDt", collectionDate.format(DateTimeFormatter.ISO_LOCAL_DATE));

        xml.writeStartElement("Cdtr");
        element(xml, "Nm", creditor.getName());
        xml.writeStartElement("PstlAdr");
        element(xml, "Ctry", creditor.getCountry());
        element(xml, "AdrLine", creditor.getAddressLine1());
        element(xml, "AdrLine", creditor.getAddressLine2());
        xml.writeEndElement();
        xml.writeEndElement();

        account(xml, "CdtrAcct", creditor.getIban());
        agent(xml, "CdtrAgt");
        element(xml, "ChrgBr", "SLEV");

        xml.writeStartElement("CdtrSchmeId");
        xml.writeStartElement("Id");
        xml.writeStartElement("PrvtId");
        xml.writeStartElement("Othr");
        element(xml, "Id", creditor.getCreditorId());
        xml.writeStartElement("SchmeNm");
        element(xml, "Prtry", "SEPA");
        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndElement();

        for (SepaDirectDebit debit : debits) {
            writeTransaction(xml, debit);
        }
        xml.writeEndElement();
    }

    private void writeTransaction(XMLStreamWriter xml, SepaDirectDebit debit) throws XMLStreamException {
        xml.writeStartElement("DrctDbtTxInf");
        xml.writeStartElement("PmtId");
        element(xml, "EndToEndId", debit.getEndToEndId());
        xml.writeEndElement();

        xml.writeStartElement("InstdAmt");
        xml.writeAttribute("Ccy", "EUR");
        xml.writeCharacters(amount(debit.getAmount()));
        xml.writeEndElement();

        xml.writeStartElement("DrctDbtTx");
        xml.writeStartElement("MndtRltdInf");
        element(xml, "MndtId", debit.getMandateReference());
        element(xml, "DtOfSgntr", debit.getMandateDate().format(DateTimeFormatter.ISO_LOCAL_DATE));
        xml.writeEndElement();
        xml.writeEndElement();

        agent(xml, "DbtrAgt");
        xml.writeStartElement("Dbtr");
        element(xml, "Nm", debit.getDebtorName());
        xml.writeEndElement();
        account(xml, "DbtrAcct", debit.getDebtorIban());

        xml.writeStartElement("RmtInf");
        element(xml, "Ustrd", debit.getRemittance());
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private static void account(XMLStreamWriter xml, String name, String iban) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeStartElement("Id");
        element(xml, "IBAN", iban);
        xml.writeEndElement();
        xml.writeEndElement();
    }

    // BIC-less (IBAN only) agents
    private static void agent(XMLStreamWriter xml, String name) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeStartElement("FinInstnId");
        xml.writeStartElement("Othr");
        element(xml, "Id", NOT_PROVIDED);
        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndElement();
    }

    private static void element(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static String amount(BigDecimal value) {
        return value.setScale(2, RoundingMode.UNNECESSARY).toPlainString();
    }
}
