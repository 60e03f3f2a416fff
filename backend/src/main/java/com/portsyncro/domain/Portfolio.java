package com.portsyncro.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Holdings of one user, keyed by user id. Written by the (external) add/sell/edit flows; read-only here.
 */
@Document(collection = "portfolios")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Portfolio {

    @Id
    @EqualsAndHashCode.Include
    private String userId;
    private List<Position> stocks = new ArrayList<>();
    private List<Position> crypto = new ArrayList<>();
    private List<Position> gold = new ArrayList<>();
    private List<Position> cash = new ArrayList<>();
    private Instant updatedAt;

    public List<Position> getStocks() {
        return unmodifiable(stocks);
    }

    public List<Position> getCrypto() {
        return unmodifiable(crypto);
    }

    public List<Position> getGold() {
        return unmodifiable(gold);
    }

    public List<Position> getCash() {
        return unmodifiable(cash);
    }

    public Portfolio setStocks(List<Position> stocks) {
        this.stocks = copy(stocks);
        return this;
    }

    public Portfolio setCrypto(List<Position> crypto) {
        this.crypto = copy(crypto);
        return this;
    }

    public Portfolio setGold(List<Position> gold) {
        this.gold = copy(gold);
        return this;
    }

    public Portfolio setCash(List<Position> cash) {
        this.cash = copy(cash);
        return this;
    }

    /** All positions in stock, crypto, gold, cash order. */
    public List<Position> allPositions() {
        return Stream.of(getStocks(), getCrypto(), getGold(), getCash())
                .flatMap(List::stream)
                .toList();
    }

    private static List<Position> unmodifiable(List<Position> list) {
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    private static List<Position> copy(List<Position> list) {
        return list == null ? new ArrayList<>() : new ArrayList<>(list);
    }
}
