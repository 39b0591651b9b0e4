package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.RegistryError;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Decides whether a caller may mutate a token. Has no side effects. */
@Slf4j
@RequiredArgsConstructor
public class AccessGuard {

  private final OwnershipLedgerPort ownershipLedger;

  /**
   * @return success if {@code caller} owns {@code tokenId}; {@link RegistryError#NOT_FOUND} if the
   *     token was never issued; {@link RegistryError#NOT_OWNER} if someone else owns it
   */
  public Result<Void> authorizeMutation(TokenId tokenId, Identity caller) {
    Optional<Identity> owner = ownershipLedger.ownerOf(tokenId);
    if (owner.isEmpty()) {
      return Result.failure(RegistryError.NOT_FOUND, "Token " + tokenId + " does not exist");
    }
    if (!owner.get().equals(caller)) {
      log.debug("Caller {} is not the owner of token {} (owner {})", caller, tokenId, owner.get());
      return Result.failure(
          RegistryError.NOT_OWNER, "Caller " + caller + " does not own token " + tokenId);
    }
    return Result.success();
  }
}
