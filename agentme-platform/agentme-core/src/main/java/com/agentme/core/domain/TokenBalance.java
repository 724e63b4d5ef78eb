package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Balance of one token held in one custody account.
 */
@Entity
@Table(name = "token_balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_balance_account_token", columnNames = {"account", "token"})
})
public class TokenBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(nullable = false, length = 320)
    private String account;

    @NotBlank
    @Column(nullable = false)
    private String token;

    @NotNull
    @PositiveOrZero
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @Version
    private Long version;

    protected TokenBalance() {}

    public static TokenBalance open(String account, String token) {
        var balance = new TokenBalance();
        balance.account = account;
        balance.token = token;
        balance.balance = BigInteger.ZERO;
        return balance;
    }

    public void credit(BigInteger amount) {
        balance = balance.add(amount);
    }

    public void debit(BigInteger amount) {
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                    account + " holds " + balance + " " + token + ", needs " + amount);
        }
        balance = balance.subtract(amount);
    }

    // Getters
    public UUID getId() { return id; }
    public String getAccount() { return account; }
    public String getToken() { return token; }
    public BigInteger getBalance() { return balance; }
}
