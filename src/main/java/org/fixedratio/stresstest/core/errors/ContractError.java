package org.fixedratio.stresstest.core.errors;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Error codes returned by the fixed-ratio trading contract.
 */
public enum ContractError {
    // System and configuration
    UNAUTHORIZED(1001, "Unauthorized access"),
    INVALID_TOKEN_MINTS(1002, "Invalid token mints - ensure correct ordering (smaller pubkey = Token A)"),
    INVALID_RATIO(1003, "Invalid pool ratio - ensure one side equals 10^decimals"),
    SYSTEM_PAUSED(1004, "System is paused - no operations allowed", ErrorKind.SYSTEM_PAUSED),
    POOL_PAUSED(1005, "Pool is paused - no liquidity operations allowed", ErrorKind.POOL_PAUSED),
    ALREADY_PAUSED(1006, "Already paused"),
    NOT_PAUSED(1007, "Not paused"),
    INVALID_OWNER(1008, "Invalid owner"),
    INVALID_SYSTEM(1009, "Invalid system account"),
    INVALID_TOKEN_DECIMALS(1010, "Invalid token decimals"),

    // Pool state
    POOL_ALREADY_EXISTS(1011, "Pool already exists for this token pair"),
    POOL_NOT_FOUND(1012, "Pool not found"),
    INVALID_POOL_STATE(1013, "Invalid pool state"),
    INVALID_TOKEN_ACCOUNT(1014, "Invalid token account", ErrorKind.INVALID_TOKEN_ACCOUNT),

    // Fees
    INSUFFICIENT_FUNDS(1015, "Insufficient funds for operation", ErrorKind.INSUFFICIENT_FUNDS),
    INVALID_FEE_RATE(1016, "Invalid fee rate"),
    FEE_TOO_HIGH(1017, "Fee exceeds maximum allowed"),
    INVALID_TREASURY(1018, "Invalid treasury account"),

    // Liquidity
    INVALID_AMOUNT(1019, "Invalid amount - must be greater than 0"),
    INSUFFICIENT_LIQUIDITY(1020, "Insufficient liquidity in pool", ErrorKind.INSUFFICIENT_LIQUIDITY),
    INVALID_LP_TOKEN_TYPE(1021, "Invalid LP token type for this operation", ErrorKind.INVALID_LP_TOKEN_TYPE),
    INSUFFICIENT_LP_TOKENS(1022, "Insufficient LP tokens for withdrawal"),
    DEPOSIT_TOO_SMALL(1023, "Deposit amount too small"),
    WITHDRAWAL_TOO_SMALL(1024, "Withdrawal amount too small"),

    // Swaps
    SWAP_AMOUNT_TOO_SMALL(1025, "Swap amount too small"),
    SLIPPAGE_EXCEEDED(1026, "Slippage tolerance exceeded", ErrorKind.SLIPPAGE_EXCEEDED),
    INVALID_SWAP_DIRECTION(1027, "Invalid swap direction"),
    INVALID_INPUT_AMOUNT(1028, "Invalid input amount"),
    INVALID_MINIMUM_OUTPUT(1029, "Invalid minimum output amount"),
    POOL_SWAPS_PAUSED(1030, "Pool swaps are paused", ErrorKind.POOL_SWAPS_PAUSED),

    // Accounts and PDAs
    INVALID_ACCOUNT_OWNER(1031, "Invalid account owner"),
    INVALID_MINT_AUTHORITY(1032, "Invalid mint authority"),
    INVALID_PDA(1033, "Invalid PDA derivation"),
    ACCOUNT_ALREADY_INITIALIZED(1034, "Account already initialized"),
    ACCOUNT_NOT_INITIALIZED(1035, "Account not initialized"),
    INVALID_SIGNER(1036, "Invalid signer"),

    // Program
    INVALID_INSTRUCTION(1037, "Invalid instruction"),
    MISSING_REQUIRED_SIGNATURE(1038, "Missing required signature"),
    INVALID_PROGRAM_ID(1039, "Invalid program ID"),
    INVALID_ACCOUNT_DATA(1040, "Invalid account data"),
    ACCOUNT_BORROW_FAILED(1041, "Account borrow failed"),
    INSTRUCTION_PACK_ERROR(1042, "Instruction pack error");

    private static final Map<Integer, ContractError> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ContractError::code, Function.identity()));

    private final int code;
    private final String message;
    private final ErrorKind kind;

    ContractError(int code, String message) {
        this(code, message, ErrorKind.UNKNOWN);
    }

    ContractError(int code, String message, ErrorKind kind) {
        this.code = code;
        this.message = message;
        this.kind = kind;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    /**
     * Returns the recovery kind for this code. Codes without a dedicated policy are {@link ErrorKind#UNKNOWN}.
     *
     * @return The error kind.
     */
    public ErrorKind kind() {
        return kind;
    }

    public static Optional<ContractError> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Returns the message for a code, or a generic message for codes the contract does not define.
     *
     * @param code The numeric error code.
     * @return A human-readable message.
     */
    public static String messageFor(int code) {
        return fromCode(code).map(ContractError::message).orElse("Unknown error code: " + code);
    }
}
