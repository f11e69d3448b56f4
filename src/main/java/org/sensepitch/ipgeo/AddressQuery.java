package org.sensepitch.ipgeo;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous query for the address records of one type.
 *
 * @author Jens Wilke
 */
public interface AddressQuery {

  /**
   * @return addresses in answer order, empty if the name exists without records of the type. The
   *     future completes exceptionally if the query fails.
   */
  CompletableFuture<List<Address>> lookup(Hostname hostname, RecordType type);
}
