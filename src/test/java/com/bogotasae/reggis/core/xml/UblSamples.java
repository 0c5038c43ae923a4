package com.bogotasae.reggis.core.xml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds small UBL invoices for tests and loads the fixtures under {@code /invoices}.
 */
public final class UblSamples {

    public record Line(String code, String description, String quantity, String unitCode, String price) {
    }

    private UblSamples() {
    }

    public static byte[] resource(String name) {
        try (InputStream in = UblSamples.class.getResourceAsStream("/invoices/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] invoice(String number, String sellerTaxId, String buyerTaxId, List<Line> lines) {
        StringBuilder xml = new StringBuilder("""
            <?xml version="1.0" encoding="UTF-8"?>
            <Invoice xmlns="urn:oasis:names:specification:ubl:schema:xsd:Invoice-2"
                     xmlns:cac="urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2"
                     xmlns:cbc="urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2">
            """);
        xml.append("  <cbc:ID>").append(number).append("</cbc:ID>\n");
        xml.append("""
              <cbc:IssueDate>2024-01-10</cbc:IssueDate>
              <cbc:DocumentCurrencyCode>COP</cbc:DocumentCurrencyCode>
              <cac:AccountingSupplierParty><cac:Party><cac:PartyTaxScheme>
                <cbc:RegistrationName>SELLER</cbc:RegistrationName>
            """);
        xml.append("    <cbc:CompanyID>").append(sellerTaxId).append("</cbc:CompanyID>\n");
        xml.append("""
              </cac:PartyTaxScheme></cac:Party></cac:AccountingSupplierParty>
              <cac:AccountingCustomerParty><cac:Party><cac:PartyTaxScheme>
                <cbc:RegistrationName>BUYER</cbc:RegistrationName>
            """);
        xml.append("    <cbc:CompanyID>").append(buyerTaxId).append("</cbc:CompanyID>\n");
        xml.append("""
              </cac:PartyTaxScheme></cac:Party></cac:AccountingCustomerParty>
              <cac:TaxTotal><cac:TaxSubtotal><cac:TaxCategory><cbc:Percent>19</cbc:Percent></cac:TaxCategory></cac:TaxSubtotal></cac:TaxTotal>
            """);
        int id = 1;
        for (Line line : lines) {
            xml.append("  <cac:InvoiceLine><cbc:ID>").append(id++).append("</cbc:ID>")
                .append("<cbc:InvoicedQuantity unitCode=\"").append(line.unitCode()).append("\">")
                .append(line.quantity()).append("</cbc:InvoicedQuantity>")
                .append("<cac:Item><cbc:Description>").append(line.description()).append("</cbc:Description>")
                .append("<cac:SellersItemIdentification><cbc:ID>").append(line.code())
                .append("</cbc:ID></cac:SellersItemIdentification></cac:Item>")
                .append("<cac:Price><cbc:PriceAmount currencyID=\"COP\">").append(line.price())
                .append("</cbc:PriceAmount></cac:Price></cac:InvoiceLine>\n");
        }
        xml.append("</Invoice>\n");
        return xml.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static Line line(String code, String description) {
        return new Line(code, description, "1", "NIU", "1000");
    }
}
