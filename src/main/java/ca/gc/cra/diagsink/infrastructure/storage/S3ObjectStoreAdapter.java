package ca.gc.cra.diagsink.infrastructure.storage;

import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * <strong>What:</strong> {@link ObjectStorePort} backed by Amazon S3 (AWS SDK v2).
 * <p><strong>Why:</strong> Diagnostics of every benchmark host land in one bucket for later analysis.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the upload stage.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the S3 client on first upload; recording runs never touch the network.</li>
 *   <li>Create the bucket when it is missing and creation is enabled.</li>
 *   <li>Upload each file with {@code PutObject}, replacing any object with the same key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Client creation is synchronized; uploads are expected from one thread.</p>
 * <p><strong>Security:</strong> Credentials come from the default AWS provider chain.</p>
 *
 * @since 0.1.0
 */
public final class S3ObjectStoreAdapter implements ObjectStorePort {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreAdapter.class);

  private final Supplier<S3Client> clientFactory;
  private final String bucket;
  private final boolean createBucket;

  private S3Client client;
  private boolean bucketReady;

  /**
   * Creates an adapter around a lazily built client.
   *
   * @param clientFactory builds the client on first use
   * @param bucket destination bucket; must not be blank
   * @param createBucket whether to create the bucket when it does not exist
   */
  public S3ObjectStoreAdapter(Supplier<S3Client> clientFactory, String bucket, boolean createBucket) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.bucket = Objects.requireNonNull(bucket, "bucket");
    if (bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    this.createBucket = createBucket;
  }

  /**
   * Creates an adapter using the default client builder.
   *
   * @param bucket destination bucket
   * @param region region override; {@code null} or blank uses the default region chain
   * @param endpoint endpoint override (for S3 compatible stores); {@code null} or blank uses AWS
   * @param createBucket whether to create the bucket when it does not exist
   * @return adapter
   */
  public static S3ObjectStoreAdapter create(String bucket, String region, String endpoint, boolean createBucket) {
    return new S3ObjectStoreAdapter(() -> buildClient(region, endpoint), bucket, createBucket);
  }

  private static S3Client buildClient(String region, String endpoint) {
    S3ClientBuilder builder = S3Client.builder();
    if (region != null && !region.isBlank()) {
      builder.region(Region.of(region.trim()));
    }
    if (endpoint != null && !endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint.trim())).forcePathStyle(true);
    }
    return builder.build();
  }

  @Override
  public void put(String objectName, Path source) throws Exception {
    Objects.requireNonNull(objectName, "objectName");
    Objects.requireNonNull(source, "source");
    if (!Files.isRegularFile(source)) {
      throw new NoSuchFileException(source.toString());
    }
    S3Client s3 = client();
    ensureBucket(s3);
    PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(objectName)
        .contentType("text/plain")
        .build();
    s3.putObject(request, RequestBody.fromFile(source));
    log.debug("Uploaded {} to s3://{}/{}", source, bucket, objectName);
  }

  private synchronized S3Client client() {
    if (client == null) {
      client = Objects.requireNonNull(clientFactory.get(), "S3 client factory returned null");
      log.info("Created S3 client for bucket {}", bucket);
    }
    return client;
  }

  private synchronized void ensureBucket(S3Client s3) {
    if (bucketReady || !createBucket) {
      return;
    }
    try {
      s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException missing) {
      try {
        s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        log.info("Created S3 bucket {}", bucket);
      } catch (BucketAlreadyOwnedByYouException raced) {
        log.debug("Bucket {} created concurrently", bucket);
      }
    }
    bucketReady = true;
  }

  @Override
  public String describe() {
    return "s3://" + bucket;
  }

  @Override
  public synchronized void close() {
    if (client != null) {
      client.close();
      client = null;
    }
  }
}
