package com.bogotasae.reggis.core.xml;

import com.bogotasae.reggis.core.model.DocumentType;
import com.bogotasae.reggis.core.model.InvoiceLine;
import com.bogotasae.reggis.core.normalize.BrandEntityTable;
import com.bogotasae.reggis.core.normalize.NormalizedAmounts;
import com.bogotasae.reggis.core.normalize.UnitCurrencyNormalizer;
import com.bogotasae.reggis.logging.AppLogger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Parses DIAN UBL 2.1 invoices into normalized {@link InvoiceLine}s.
 * <p>
 * Instances are stateless apart from their collaborators and may be shared across worker threads.
 */
public class InvoiceExtractor {
    private static final Logger LOGGER = AppLogger.get();

    static final String UBL_PREFIX = "urn:oasis:names:specification:ubl:schema:xsd:";
    static final String CAC = UBL_PREFIX + "CommonAggregateComponents-2";
    static final String CBC = UBL_PREFIX + "CommonBasicComponents-2";

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            LOGGER.finest(() -> "XML warning: " + exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXParseException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXParseException {
            throw exception;
        }
    };

    private static final ThreadLocal<DocumentBuilder> BUILDERS = ThreadLocal.withInitial(InvoiceExtractor::newBuilder);

    private final UnitCurrencyNormalizer normalizer;
    private final BrandEntityTable brands;

    public InvoiceExtractor(UnitCurrencyNormalizer normalizer, BrandEntityTable brands) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.brands = Objects.requireNonNull(brands, "brands");
    }

    /**
     * Reads one document.
     *
     * @param sourceName file name used in messages and carried on each line
     * @param content    raw XML bytes; the encoding is taken from the XML declaration
     * @return lines for an invoice, or an empty result typed as the skipped document kind
     * @throws MalformedDocumentException if the XML is unreadable or required invoice data is absent
     */
    public ExtractedDocument extract(String sourceName, byte[] content) throws MalformedDocumentException {
        Element root = parse(sourceName, new InputSource(new ByteArrayInputStream(content)));
        DocumentType type = resolveType(sourceName, root);

        if (type == DocumentType.ATTACHED_DOCUMENT) {
            String embedded = findEmbeddedDocument(root);
            if (embedded == null) {
                throw new MalformedDocumentException(sourceName, "AttachedDocument carries no embedded invoice");
            }
            root = parse(sourceName, new InputSource(new StringReader(embedded)));
            type = resolveType(sourceName, root);
            if (type == DocumentType.ATTACHED_DOCUMENT) {
                throw new MalformedDocumentException(sourceName, "nested AttachedDocument is not supported");
            }
        }

        if (type != DocumentType.INVOICE) {
            DocumentType skippedType = type;
            LOGGER.fine(() -> sourceName + ": skipping " + skippedType + " (only invoices are exported)");
            return ExtractedDocument.skipped(sourceName, skippedType);
        }
        return extractInvoice(sourceName, root);
    }

    private ExtractedDocument extractInvoice(String sourceName, Element root) throws MalformedDocumentException {
        String invoiceNumber = text(root, "cbc:ID");
        if (invoiceNumber.isEmpty()) {
            throw new MalformedDocumentException(sourceName, "missing invoice number (cbc:ID)");
        }
        Element supplierParty = path(root, "cac:AccountingSupplierParty", "cac:Party");
        Element customerParty = path(root, "cac:AccountingCustomerParty", "cac:Party");
        String sellerTaxId = partyTaxId(supplierParty);
        if (sellerTaxId.isEmpty()) {
            throw new MalformedDocumentException(sourceName, "missing seller tax ID in AccountingSupplierParty");
        }
        String buyerTaxId = partyTaxId(customerParty);
        if (buyerTaxId.isEmpty()) {
            throw new MalformedDocumentException(sourceName, "missing buyer tax ID in AccountingCustomerParty");
        }

        String issueDate = text(root, "cbc:IssueDate");
        String dueDate = firstNonBlank(
            text(root, "cbc:DueDate"),
            text(root, "cac:PaymentMeans", "cbc:PaymentDueDate"),
            issueDate
        );
        String currency = text(root, "cbc:DocumentCurrencyCode");
        BigDecimal exchangeRate = parseDecimal(text(root, "cac:PaymentExchangeRate", "cbc:CalculationRate"));
        BigDecimal documentTaxPercent = taxPercent(root);

        Header header = new Header(
            sourceName,
            invoiceNumber,
            issueDate,
            dueDate,
            sellerTaxId,
            partyName(supplierParty),
            buyerTaxId,
            partyName(customerParty),
            firstNonBlank(
                text(customerParty, "cac:PhysicalLocation", "cac:Address", "cbc:CityName"),
                text(customerParty, "cac:PartyTaxScheme", "cac:RegistrationAddress", "cbc:CityName")
            ),
            currency,
            exchangeRate,
            documentTaxPercent
        );

        List<InvoiceLine> lines = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        List<Element> lineElements = children(root, CAC, "InvoiceLine");
        int index = 0;
        for (Element lineElement : lineElements) {
            index++;
            String problem = readLine(header, lineElement, lines);
            if (problem != null) {
                String note = "%s line %d: %s".formatted(sourceName, index, problem);
                LOGGER.fine(note);
                invalid.add(note);
            }
        }
        if (lineElements.isEmpty()) {
            LOGGER.warning(sourceName + ": invoice " + invoiceNumber + " has no InvoiceLine elements");
        }
        return new ExtractedDocument(sourceName, DocumentType.INVOICE, invoiceNumber, lines, invalid);
    }

    /**
     * Appends the parsed line to {@code out}; returns a description of the rule it broke otherwise.
     */
    private String readLine(Header header, Element line, List<InvoiceLine> out) throws MalformedDocumentException {
        Element item = child(line, CAC, "Item");
        String productName = text(item, "cbc:Description");
        String productCode = text(item, "cac:SellersItemIdentification", "cbc:ID");

        Element quantityElement = child(line, CBC, "InvoicedQuantity");
        BigDecimal quantity = parseDecimal(textOf(quantityElement));
        String unitCode = quantityElement == null ? "" : quantityElement.getAttribute("unitCode");
        if (quantity == null || quantity.signum() <= 0) {
            return "quantity must be greater than zero (was '" + textOf(quantityElement) + "')";
        }

        Element priceElement = path(line, "cac:Price", "cbc:PriceAmount");
        BigDecimal price = parseDecimal(textOf(priceElement));
        if (price == null || price.signum() <= 0) {
            return "unit price must be greater than zero (was '" + textOf(priceElement) + "')";
        }

        BigDecimal percent = taxPercent(line);
        if (percent == null) {
            percent = header.documentTaxPercent();
        }
        if (percent == null) {
            throw new MalformedDocumentException(header.sourceName(),
                "no tax rate stated for line with product " + productCode);
        }

        String currency = header.currency();
        if (currency.isEmpty() && priceElement != null) {
            currency = priceElement.getAttribute("currencyID");
        }
        NormalizedAmounts amounts = normalizer.normalize(quantity, unitCode, price, currency, header.exchangeRate());

        BigDecimal totalWithoutTax = UnitCurrencyNormalizer.round(amounts.quantity().multiply(amounts.unitPrice()));
        BigDecimal taxAmount = UnitCurrencyNormalizer.round(totalWithoutTax.multiply(percent).divide(HUNDRED));
        BigDecimal totalWithTax = totalWithoutTax.add(taxAmount);

        out.add(new InvoiceLine(
            header.sourceName(),
            header.invoiceNumber(),
            productName,
            productCode,
            amounts.unit(),
            amounts.quantity(),
            amounts.unitPrice(),
            header.issueDate(),
            header.dueDate(),
            header.buyerTaxId(),
            header.buyerName(),
            header.sellerTaxId(),
            header.sellerName(),
            header.municipality(),
            percent,
            UnitCurrencyNormalizer.round(quantity),
            amounts.currencyCode(),
            totalWithoutTax,
            taxAmount,
            totalWithTax,
            brands.effectiveEntityTaxId(productName, header.sellerTaxId()),
            amounts.normalized()
        ));
        return null;
    }

    private static BigDecimal taxPercent(Element owner) {
        for (Element taxTotal : children(owner, CAC, "TaxTotal")) {
            for (Element subtotal : children(taxTotal, CAC, "TaxSubtotal")) {
                BigDecimal percent = parseDecimal(firstNonBlank(
                    text(subtotal, "cac:TaxCategory", "cbc:Percent"),
                    text(subtotal, "cbc:Percent")
                ));
                if (percent != null) {
                    return percent;
                }
            }
        }
        return null;
    }

    private static String partyTaxId(Element party) {
        return firstNonBlank(
            text(party, "cac:PartyTaxScheme", "cbc:CompanyID"),
            text(party, "cac:PartyIdentification", "cbc:ID")
        );
    }

    private static String partyName(Element party) {
        return firstNonBlank(
            text(party, "cac:PartyLegalEntity", "cbc:RegistrationName"),
            text(party, "cac:PartyTaxScheme", "cbc:RegistrationName"),
            text(party, "cac:PartyName", "cbc:Name")
        );
    }

    private static String findEmbeddedDocument(Element root) {
        NodeList references = root.getElementsByTagNameNS(CAC, "ExternalReference");
        for (int i = 0; i < references.getLength(); i++) {
            Element description = child((Element) references.item(i), CBC, "Description");
            String value = textOf(description);
            if (value.startsWith("<")) {
                return value;
            }
        }
        return null;
    }

    private static DocumentType resolveType(String sourceName, Element root) throws MalformedDocumentException {
        String namespace = root.getNamespaceURI();
        if (namespace == null || !namespace.startsWith(UBL_PREFIX)) {
            throw new MalformedDocumentException(sourceName,
                "root element '" + root.getNodeName() + "' is not in a UBL namespace");
        }
        return DocumentType.fromRootElement(root.getLocalName());
    }

    private static Element parse(String sourceName, InputSource source) throws MalformedDocumentException {
        try {
            DocumentBuilder builder = BUILDERS.get();
            builder.reset();
            builder.setErrorHandler(STRICT_ERRORS);
            Document document = builder.parse(source);
            return document.getDocumentElement();
        } catch (SAXException | IOException ex) {
            throw new MalformedDocumentException(sourceName, "unreadable XML: " + ex.getMessage(), ex);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    /**
     * Walks direct children using {@code cac:}/{@code cbc:} prefixed steps.
     */
    static Element path(Element start, String... steps) {
        Element current = start;
        for (String step : steps) {
            if (current == null) {
                return null;
            }
            String namespace = step.startsWith("cac:") ? CAC : CBC;
            current = child(current, namespace, step.substring(4));
        }
        return current;
    }

    static String text(Element start, String... steps) {
        return textOf(path(start, steps));
    }

    private static Element child(Element parent, String namespace, String localName) {
        if (parent == null) {
            return null;
        }
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element
                && localName.equals(element.getLocalName())
                && namespace.equals(element.getNamespaceURI())) {
                return element;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element
                && localName.equals(element.getLocalName())
                && namespace.equals(element.getNamespaceURI())) {
                result.add(element);
            }
        }
        return result;
    }

    private static String textOf(Element element) {
        if (element == null) {
            return "";
        }
        String value = element.getTextContent();
        return value == null ? "" : value.trim();
    }

    private static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim().replace(',', '.'));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private record Header(String sourceName,
                          String invoiceNumber,
                          String issueDate,
                          String dueDate,
                          String sellerTaxId,
                          String sellerName,
                          String buyerTaxId,
                          String buyerName,
                          String municipality,
                          String currency,
                          BigDecimal exchangeRate,
                          BigDecimal documentTaxPercent) {
    }
}
