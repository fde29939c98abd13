package ca.gc.cra.diagsink.testutil;

import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Object store that keeps uploaded bytes in memory and fails for selected object names. */
public final class InMemoryObjectStore implements ObjectStorePort {
  private final Map<String, byte[]> objects = new LinkedHashMap<>();
  private final Set<String> failing = new HashSet<>();
  private final List<String> attempts = new ArrayList<>();
  private boolean closed;

  public InMemoryObjectStore failOn(String objectName) {
    failing.add(objectName);
    return this;
  }

  public void heal(String objectName) {
    failing.remove(objectName);
  }

  @Override
  public void put(String objectName, Path source) throws IOException {
    attempts.add(objectName);
    if (failing.contains(objectName)) {
      throw new IOException("simulated upload failure for " + objectName);
    }
    objects.put(objectName, Files.readAllBytes(source));
  }

  @Override
  public String describe() {
    return "memory://test";
  }

  @Override
  public void close() {
    closed = true;
  }

  public Map<String, byte[]> objects() {
    return objects;
  }

  public String text(String objectName) {
    byte[] bytes = objects.get(objectName);
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }

  public List<String> attempts() {
    return attempts;
  }

  public boolean isClosed() {
    return closed;
  }
}
