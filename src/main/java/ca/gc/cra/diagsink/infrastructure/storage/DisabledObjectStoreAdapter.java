package ca.gc.cra.diagsink.infrastructure.storage;

import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import java.nio.file.Path;

/**
 * Object store used when uploads are disabled ({@code storeMode=NONE}). Any upload attempt fails,
 * so a miswired upload surfaces as a per-file failure instead of silently succeeding.
 */
public final class DisabledObjectStoreAdapter implements ObjectStorePort {
  @Override
  public void put(String objectName, Path source) {
    throw new UnsupportedOperationException("Uploads disabled (storeMode=NONE)");
  }

  @Override
  public String describe() {
    return "disabled";
  }
}
