package com.simiq.rag.service.batch;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.config.RagConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;

/**
 * Step 4 of the batch indexing pipeline: archive the transformed catalog, embeddings included,
 * as one Parquet file per run.
 *
 * <p>Files land in {@code <snapshot-dir>/date=YYYY-MM-DD/products-<runId>.parquet} and are never
 * overwritten. When a GCS bucket is configured the file is copied to the same relative path
 * under {@code gs://<bucket>/<prefix>/}.
 */
@Slf4j
@Service
public class SnapshotService {

    static final Schema PRODUCT_SCHEMA = SchemaBuilder.record("Product")
            .namespace("com.simiq.snapshot")
            .fields()
            .requiredString(ProductDTO.PRODUCT_ID)
            .requiredString(ProductDTO.PRODUCT_NAME)
            .requiredString(ProductDTO.MAIN_CATEGORY)
            .requiredString(ProductDTO.SUB_CATEGORY)
            .optionalDouble(ProductDTO.RATINGS)
            .optionalInt(ProductDTO.NO_OF_RATINGS)
            .optionalString(ProductDTO.PRICE)
            .optionalString(ProductDTO.PRICE_USD)
            .name("embedding").type().array().items().floatType().noDefault()
            .requiredString("embedding_model")
            .endRecord();

    private final RagConfig ragConfig;
    @Nullable
    private final Storage storage;

    public record SnapshotResult(Path localPath, String gcsUri, int rowCount) {
    }

    @Autowired
    public SnapshotService(RagConfig ragConfig, @Value("${vertex.ai.project-id:}") String projectId) {
        this(ragConfig, createStorage(ragConfig, projectId));
    }

    SnapshotService(RagConfig ragConfig, @Nullable Storage storage) {
        this.ragConfig = ragConfig;
        this.storage = storage;
    }

    private static Storage createStorage(RagConfig ragConfig, String projectId) {
        String bucket = ragConfig.getBatchIndexing().getGcsBucket();
        if (bucket == null || bucket.isBlank()) {
            log.info("No snapshot bucket configured - snapshots are kept locally only");
            return null;
        }
        try {
            StorageOptions.Builder options = StorageOptions.newBuilder();
            if (projectId != null && !projectId.isBlank()) {
                options.setProjectId(projectId);
            }
            Storage storage = options.build().getService();
            log.info("Initialized GCS client for snapshots: bucket={}", bucket);
            return storage;
        } catch (Exception e) {
            log.error("Failed to initialize GCS client: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Write one snapshot file for this run.
     *
     * @throws UncheckedIOException if the file exists already or cannot be written
     */
    public SnapshotResult write(List<ProductDTO> products, String runId, LocalDate date, String embeddingModel) {
        String partition = "date=" + date;
        String fileName = "products-" + runId + ".parquet";
        Path target = Paths.get(ragConfig.getBatchIndexing().getSnapshotDir(), partition, fileName)
                .toAbsolutePath();

        log.info("Writing snapshot of {} products to {}", products.size(), target);
        long startTime = System.currentTimeMillis();

        try {
            if (Files.exists(target)) {
                throw new IOException("Snapshot already exists: " + target);
            }
            Files.createDirectories(target.getParent());
            writeParquet(target, products, embeddingModel);
        } catch (IOException e) {
            log.error("Failed to write snapshot {}: {}", target, e.getMessage());
            throw new UncheckedIOException("Failed to write snapshot " + target, e);
        }

        String gcsUri = null;
        if (storage != null) {
            gcsUri = upload(target, partition + "/" + fileName);
        }

        log.info("Snapshot complete: {} rows in {}ms", products.size(), System.currentTimeMillis() - startTime);
        return new SnapshotResult(target, gcsUri, products.size());
    }

    private void writeParquet(Path target, List<ProductDTO> products, String embeddingModel) throws IOException {
        Configuration conf = new Configuration();
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(target.toUri());

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(HadoopOutputFile.fromPath(hadoopPath, conf))
                .withSchema(PRODUCT_SCHEMA)
                .withConf(conf)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .build()) {
            for (ProductDTO product : products) {
                writer.write(toRecord(product, embeddingModel));
            }
        }
    }

    private static GenericRecord toRecord(ProductDTO product, String embeddingModel) {
        GenericRecord record = new GenericData.Record(PRODUCT_SCHEMA);
        record.put(ProductDTO.PRODUCT_ID, product.getProductId());
        record.put(ProductDTO.PRODUCT_NAME, product.getProductName());
        record.put(ProductDTO.MAIN_CATEGORY, product.getMainCategory());
        record.put(ProductDTO.SUB_CATEGORY, product.getSubCategory());
        record.put(ProductDTO.RATINGS, product.getRatings());
        record.put(ProductDTO.NO_OF_RATINGS, product.getNoOfRatings());
        record.put(ProductDTO.PRICE, product.getPrice());
        record.put(ProductDTO.PRICE_USD, product.getPriceUsd());
        record.put("embedding", product.getEmbedding() != null ? product.getEmbedding() : List.of());
        record.put("embedding_model", embeddingModel);
        return record;
    }

    private String upload(Path localFile, String relativePath) {
        String bucket = ragConfig.getBatchIndexing().getGcsBucket();
        String prefix = ragConfig.getBatchIndexing().getGcsPrefix();
        String objectName = prefix == null || prefix.isBlank() ? relativePath : prefix + "/" + relativePath;

        BlobId blobId = BlobId.of(bucket, objectName);
        BlobInfo blobInfo = BlobInfo.newBuilder(blobId)
                .setContentType("application/vnd.apache.parquet")
                .build();

        try {
            storage.create(blobInfo, Files.readAllBytes(localFile), Storage.BlobTargetOption.doesNotExist());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + localFile, e);
        }

        String gcsUri = String.format("gs://%s/%s", bucket, objectName);
        log.info("Uploaded snapshot to {}", gcsUri);
        return gcsUri;
    }

    public boolean isRemoteEnabled() {
        return storage != null;
    }
}
