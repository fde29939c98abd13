package ca.gc.cra.diagsink.infrastructure.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

class S3ObjectStoreAdapterTest {
  @TempDir Path tempDir;

  @Test
  void createsMissingBucketOnceAndUploadsFiles() throws Exception {
    FakeS3Client fake = new FakeS3Client(false);
    AtomicInteger factoryCalls = new AtomicInteger();
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(() -> {
      factoryCalls.incrementAndGet();
      return fake;
    }, "diagnostics", true);
    Path first = Files.writeString(tempDir.resolve("a.out"), "1 ; a\n");
    Path second = Files.writeString(tempDir.resolve("b.out"), "2 ; b\n");

    adapter.put("host-host-0.out", first);
    adapter.put("host-host-1.out", second);
    adapter.close();

    assertEquals(1, factoryCalls.get());
    assertEquals(1, fake.headCalls);
    assertEquals(List.of("diagnostics"), fake.createdBuckets);
    assertEquals("1 ; a\n", fake.objects.get("diagnostics/host-host-0.out"));
    assertEquals("2 ; b\n", fake.objects.get("diagnostics/host-host-1.out"));
    assertEquals("text/plain", fake.lastContentType);
    assertTrue(fake.closed);
    assertEquals("s3://diagnostics", adapter.describe());
  }

  @Test
  void skipsBucketChecksWhenCreationDisabled() throws Exception {
    FakeS3Client fake = new FakeS3Client(true);
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(() -> fake, "diagnostics", false);

    adapter.put("x.out", Files.writeString(tempDir.resolve("x"), "x"));

    assertEquals(0, fake.headCalls);
    assertTrue(fake.createdBuckets.isEmpty());
  }

  @Test
  void missingFileFailsBeforeClientIsBuilt() {
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(() -> {
      throw new AssertionError("client should not be created");
    }, "diagnostics", true);

    assertThrows(NoSuchFileException.class, () -> adapter.put("gone.out", tempDir.resolve("gone")));
    adapter.close();
  }

  @Test
  void putFailurePropagates() throws Exception {
    FakeS3Client fake = new FakeS3Client(true);
    fake.failPuts = true;
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(() -> fake, "diagnostics", true);

    assertThrows(RuntimeException.class,
        () -> adapter.put("x.out", Files.writeString(tempDir.resolve("x"), "x")));
  }

  private static final class FakeS3Client implements S3Client {
    private final boolean bucketExists;
    private final Map<String, String> objects = new LinkedHashMap<>();
    private final List<String> createdBuckets = new ArrayList<>();
    private int headCalls;
    private String lastContentType;
    private boolean failPuts;
    private boolean closed;

    FakeS3Client(boolean bucketExists) {
      this.bucketExists = bucketExists;
    }

    @Override
    public HeadBucketResponse headBucket(HeadBucketRequest request) {
      headCalls++;
      if (!bucketExists && !createdBuckets.contains(request.bucket())) {
        throw NoSuchBucketException.builder().message("no such bucket").build();
      }
      return HeadBucketResponse.builder().build();
    }

    @Override
    public CreateBucketResponse createBucket(CreateBucketRequest request) {
      createdBuckets.add(request.bucket());
      return CreateBucketResponse.builder().build();
    }

    @Override
    public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
      if (failPuts) {
        throw new IllegalStateException("simulated S3 outage");
      }
      try (InputStream in = body.contentStreamProvider().newStream()) {
        objects.put(request.bucket() + "/" + request.key(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
      lastContentType = request.contentType();
      return PutObjectResponse.builder().build();
    }

    @Override
    public String serviceName() {
      return "s3";
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
