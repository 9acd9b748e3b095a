// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.wallet;

public enum WalletCapability {
    SIGN_MESSAGE,
    SIGN_TRANSACTION,
    SEND_TRANSACTION,
    RAW_REQUEST,
    READ_PROVIDER
}
