package com.simiq.rag.service.batch;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.dto.CatalogRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Step 1 of the batch indexing pipeline: read the product catalog into typed products.
 *
 * <p>Accepts a CSV file with a header row, or line-delimited JSON ({@code .jsonl} / {@code .ldjson})
 * with the same field names. Rows missing a name or either category are skipped; numeric columns
 * that do not parse become absent rather than failing the row.
 */
@Slf4j
@Service
public class CatalogIngestService {

    private static final Pattern GROUPED_THOUSANDS = Pattern.compile("^\\d{1,3}(,\\d{3})+$");

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public CatalogIngestService() {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Result of reading one catalog file.
     */
    public record IngestResult(List<ProductDTO> products, int rowsRead, int rowsSkipped) {
    }

    /**
     * Read every valid row of the catalog at {@code catalogPath}.
     *
     * @throws UncheckedIOException if the file cannot be opened or read
     */
    public IngestResult ingest(Path catalogPath) {
        log.info("Reading catalog from: {}", catalogPath);
        long startTime = System.currentTimeMillis();

        IngestResult result = isLineDelimitedJson(catalogPath)
                ? readLdjson(catalogPath)
                : readCsv(catalogPath);

        log.info("Catalog read complete: {} products, {} skipped (from {} rows) in {}ms",
                result.products().size(), result.rowsSkipped(), result.rowsRead(),
                System.currentTimeMillis() - startTime);
        return result;
    }

    private IngestResult readCsv(Path catalogPath) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<ProductDTO> products = new ArrayList<>();
        int rowsRead = 0;
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(catalogPath, StandardCharsets.UTF_8);
             MappingIterator<CatalogRow> rows = csvMapper.readerFor(CatalogRow.class)
                     .with(schema)
                     .readValues(reader)) {

            while (rows.hasNextValue()) {
                rowsRead++;
                CatalogRow row;
                try {
                    row = rows.nextValue();
                } catch (IOException | RuntimeException e) {
                    skipped++;
                    log.warn("Skipping malformed CSV row {}: {}", rowsRead, e.getMessage());
                    continue;
                }

                ProductDTO product = toProduct(row);
                if (product == null) {
                    skipped++;
                    log.debug("Skipping CSV row {}: missing name or category", rowsRead);
                } else {
                    products.add(product);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read catalog {}: {}", catalogPath, e.getMessage());
            throw new UncheckedIOException("Failed to read catalog " + catalogPath, e);
        }

        return new IngestResult(products, rowsRead, skipped);
    }

    private IngestResult readLdjson(Path catalogPath) {
        List<ProductDTO> products = new ArrayList<>();
        int lineCount = 0;
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(catalogPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                lineCount++;

                try {
                    CatalogRow row = objectMapper.readValue(line, CatalogRow.class);
                    ProductDTO product = toProduct(row);
                    if (product == null) {
                        skipped++;
                        log.debug("Skipping line {}: missing name or category", lineCount);
                    } else {
                        products.add(product);
                    }
                } catch (IOException e) {
                    skipped++;
                    log.warn("Skipping malformed line {}: {}", lineCount, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to read catalog {}: {}", catalogPath, e.getMessage());
            throw new UncheckedIOException("Failed to read catalog " + catalogPath, e);
        }

        return new IngestResult(products, lineCount, skipped);
    }

    /**
     * Convert a raw row to a product, or null if the row lacks a name or a category.
     */
    static ProductDTO toProduct(CatalogRow row) {
        if (row == null || !row.isValid()) {
            return null;
        }

        String name = row.getProductName().trim();
        String mainCategory = row.getMainCategory().trim();
        String subCategory = row.getSubCategory().trim();
        String price = blankToNull(row.getPrice());

        String productId = blankToNull(row.getProductId());
        if (productId == null) {
            productId = derivedProductId(name, mainCategory, subCategory, price);
        }

        return ProductDTO.builder()
                .productId(productId)
                .productName(name)
                .mainCategory(mainCategory)
                .subCategory(subCategory)
                .ratings(parseRatings(row.getRatings()))
                .noOfRatings(parseRatingCount(row.getNoOfRatings()))
                .price(price)
                .build();
    }

    /**
     * Stable id for rows without one, so re-running on the same catalog updates rather than duplicates.
     */
    static String derivedProductId(String name, String mainCategory, String subCategory, String price) {
        String key = String.join("|", name, mainCategory, subCategory, price != null ? price : "");
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static Double parseRatings(String value) {
        return parseFinite(value);
    }

    static Integer parseRatingCount(String value) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return null;
        }
        if (GROUPED_THOUSANDS.matcher(trimmed).matches()) {
            trimmed = trimmed.replace(",", "");
        }
        Double parsed = parseFinite(trimmed);
        if (parsed == null || parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            return null;
        }
        return parsed.intValue();
    }

    private static Double parseFinite(String value) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static boolean isLineDelimitedJson(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".jsonl") || fileName.endsWith(".ldjson");
    }
}
