package com.flagship.creator_ledger.support;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.payment.PaymentGateway;
import com.flagship.creator_ledger.payment.TransferResult;
import lombok.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Payment gateway that records successful transfers and can be told to refuse them.
 */
public class RecordingPaymentGateway implements PaymentGateway {

    private final List<Transfer> transfers = Collections.synchronizedList(new ArrayList<>());
    private final Set<Address> refusedPayees = ConcurrentHashMap.newKeySet();
    private volatile boolean refuseAll;

    @Override
    public TransferResult transfer(Address from, Address to, BigInteger amount) {
        if (refuseAll || refusedPayees.contains(to)) {
            return TransferResult.failed("insufficient allowance");
        }
        transfers.add(new Transfer(from, to, amount));
        return TransferResult.succeeded("tx-" + transfers.size());
    }

    public void refuseAll() {
        this.refuseAll = true;
    }

    public void refuseTransfersTo(Address payee) {
        refusedPayees.add(payee);
    }

    public List<Transfer> getTransfers() {
        synchronized (transfers) {
            return new ArrayList<>(transfers);
        }
    }

    /**
     * Received minus sent across all recorded transfers.
     */
    public BigInteger netAmountFor(Address address) {
        BigInteger net = BigInteger.ZERO;
        for (Transfer transfer : getTransfers()) {
            if (transfer.getTo().equals(address)) {
                net = net.add(transfer.getAmount());
            }
            if (transfer.getFrom().equals(address)) {
                net = net.subtract(transfer.getAmount());
            }
        }
        return net;
    }

    @Value
    public static class Transfer {
        Address from;
        Address to;
        BigInteger amount;
    }
}
