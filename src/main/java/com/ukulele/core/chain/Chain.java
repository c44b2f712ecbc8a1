package com.ukulele.core.chain;

import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.exception.ItemNotFoundException;

/**
 * Read access to the local block store as needed by block synchronization.
 */
public interface Chain {

  /**
   * @throws ItemNotFoundException if no block with the given hash is known locally
   */
  ExtendedBlock findBlock(Sha256Hash hash) throws ItemNotFoundException;

  boolean containBlock(Sha256Hash hash);
}
