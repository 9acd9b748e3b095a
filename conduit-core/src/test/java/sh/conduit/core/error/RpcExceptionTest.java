// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RpcExceptionTest {

    @Test
    void classifiesUserRejection() {
        assertTrue(new RpcException(4001, "User rejected the request.").isUserRejection());
        assertTrue(new RpcException(-32000, "MetaMask Tx Signature: User denied transaction signature.").isUserRejection());
        assertFalse(new RpcException(-32000, "execution reverted").isUserRejection());
    }

    @Test
    void classifiesMissingMethods() {
        assertTrue(new RpcException(-32601, "the method eth_maxPriorityFeePerGas does not exist").isMethodMissing());
        assertTrue(new RpcException(4200, "Unsupported method").isMethodMissing());
        assertFalse(new RpcException(-32000, "header not found").isMethodMissing());
    }

    @Test
    void classifiesNonceCollisions() {
        assertTrue(new RpcException(-32000, "nonce too low").isNonceCollision());
        assertTrue(new RpcException(-32000, "replacement transaction underpriced").isNonceCollision());
        assertFalse(new RpcException(-32000, "already known").isNonceCollision());
        assertFalse(new RpcException(-32000, "insufficient funds for gas * price + value").isNonceCollision());
    }

    @Test
    void classifiesAlreadyKnownAsAccepted() {
        assertTrue(new RpcException(-32000, "already known").isAlreadyKnown());
        assertTrue(new RpcException(-32010, "Transaction with the same hash was already imported.").isAlreadyKnown());
        assertFalse(new RpcException(-32000, "nonce too low").isAlreadyKnown());
    }

    @Test
    void carriesKindAndRequestId() {
        RpcException ex = new RpcException(-32000, "boom", null, 7L);

        assertEquals(ErrorKind.RPC_FAILURE, ex.kind());
        assertEquals("[requestId=7] boom", ex.getMessage());
    }

    @Test
    void gasPriceMessageIsActionable() {
        GasPriceExceededException ex = GasPriceExceededException.price(
                sh.conduit.core.types.Wei.gwei(250), sh.conduit.core.types.Wei.gwei(100));

        assertEquals(ErrorKind.GAS_PRICE_EXCEEDED, ex.kind());
        assertTrue(ex.getMessage().contains("250"));
        assertTrue(ex.getMessage().contains("100"));
    }
}
