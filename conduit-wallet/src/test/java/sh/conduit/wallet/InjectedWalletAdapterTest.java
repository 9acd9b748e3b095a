// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.conduit.core.error.CapabilityMissingException;
import sh.conduit.core.error.NotConnectedException;
import sh.conduit.core.error.RpcException;
import sh.conduit.core.error.UserRejectedException;
import sh.conduit.core.model.TransactionRequest;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;
import sh.conduit.primitives.Hex;
import sh.conduit.rpc.JsonRpcResponse;
import sh.conduit.rpc.RpcProvider;

@ExtendWith(MockitoExtension.class)
class InjectedWalletAdapterTest {

    private static final String ACCOUNT = "0xc9d0602a87e55116f633b1a1f95d083eb115f942";

    @Mock
    private RpcProvider wallet;

    private InjectedWalletAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InjectedWalletAdapter(wallet, Runnable::run);
    }

    @Test
    void connectRequestsAccounts() {
        when(wallet.send(eq("eth_requestAccounts"), any())).thenReturn(JsonRpcResponse.ofResult(List.of(ACCOUNT)));

        Address address = adapter.connect().join();

        assertEquals(new Address(ACCOUNT), address);
        assertEquals(address, adapter.getAddress());
        assertTrue(adapter.isConnected());
    }

    @Test
    void rejectedConnectFailsWithUserRejected() {
        when(wallet.send(eq("eth_requestAccounts"), any()))
                .thenThrow(new RpcException(4001, "User rejected the request."));

        CompletableFuture<Address> future = adapter.connect();

        CompletionException ex = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(UserRejectedException.class, ex.getCause());
        assertThrows(NotConnectedException.class, () -> adapter.getAddress());
    }

    @Test
    void readinessIsNotReadyWhileExtensionIsUnreachable() {
        when(wallet.send(eq("eth_accounts"), any())).thenThrow(new RpcException(
                RpcException.NETWORK_ERROR_CODE, "Network error", null, null, new IOException("no provider")));

        assertEquals(ProviderReadiness.NOT_READY, adapter.readiness());
    }

    @Test
    void readinessIsDisconnectedWithoutAccounts() {
        when(wallet.send(eq("eth_accounts"), any())).thenReturn(JsonRpcResponse.ofResult(List.of()));

        assertEquals(ProviderReadiness.READY_DISCONNECTED, adapter.readiness());
    }

    @Test
    void readinessRestoresPreviouslyAuthorizedAccount() {
        when(wallet.send(eq("eth_accounts"), any())).thenReturn(JsonRpcResponse.ofResult(List.of(ACCOUNT)));

        assertEquals(ProviderReadiness.READY_CONNECTED, adapter.readiness());
        assertEquals(new Address(ACCOUNT), adapter.getAddress());
    }

    @Test
    void signMessageUsesPersonalSignWithHexPayload() {
        when(wallet.send(eq("eth_requestAccounts"), any())).thenReturn(JsonRpcResponse.ofResult(List.of(ACCOUNT)));
        when(wallet.send(eq("personal_sign"), any())).thenReturn(JsonRpcResponse.ofResult("0x" + "11".repeat(65)));
        adapter.connect().join();

        HexData signature = adapter.signMessage("hello");

        assertEquals(65, signature.byteLength());
        verify(wallet).send("personal_sign", List.of(Hex.encodeUtf8("hello"), ACCOUNT));
    }

    @Test
    void undeclaredCapabilityFailsWithoutContactingWallet() {
        TransactionRequest request = new TransactionRequest(new Address(ACCOUNT), null, null, null, 21_000L, null, 1L);

        CapabilityMissingException ex =
                assertThrows(CapabilityMissingException.class, () -> adapter.signTransaction(request));

        assertEquals("SIGN_TRANSACTION", ex.capability());
        verifyNoInteractions(wallet);
    }

    @Test
    void unsupportedMethodMapsToCapabilityMissing() {
        when(wallet.send(eq("eth_signTypedData_v4"), any()))
                .thenThrow(new RpcException(-32601, "the method eth_signTypedData_v4 does not exist"));

        assertThrows(CapabilityMissingException.class, () -> adapter.request("eth_signTypedData_v4", List.of()));
    }

    @Test
    void disconnectClearsAddressEvenWithoutRevokeSupport() {
        when(wallet.send(eq("eth_requestAccounts"), any())).thenReturn(JsonRpcResponse.ofResult(List.of(ACCOUNT)));
        when(wallet.send(eq("wallet_revokePermissions"), any()))
                .thenThrow(new RpcException(4200, "Unsupported method"));
        adapter.connect().join();

        adapter.disconnect();

        assertThrows(NotConnectedException.class, () -> adapter.getAddress());
    }
}
