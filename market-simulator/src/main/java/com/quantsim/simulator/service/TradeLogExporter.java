package com.quantsim.simulator.service;

import com.quantsim.simulator.domain.TradeRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes a trade log as CSV, one row per fill.
 */
@Component
public class TradeLogExporter {

    static final String HEADER =
            "date,asset,raw_price,executed_price,action,quantity,gross_value,net_cash_delta,cost,signed_quantity";

    public String toCsv(List<TradeRecord> trades) {
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (TradeRecord trade : trades) {
            csv.append(trade.getDate()).append(',')
                    .append(trade.getAsset()).append(',')
                    .append(trade.getRawPrice().toPlainString()).append(',')
                    .append(trade.getExecutedPrice().toPlainString()).append(',')
                    .append(trade.getAction()).append(',')
                    .append(trade.getQuantity()).append(',')
                    .append(trade.getGrossValue().toPlainString()).append(',')
                    .append(trade.getNetCashDelta().toPlainString()).append(',')
                    .append(trade.getCost().toPlainString()).append(',')
                    .append(trade.getSignedQuantity()).append('\n');
        }
        return csv.toString();
    }
}
