package tw.gc.quant.backtest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class QuantBacktestApplication {

    static {
        // Calendar periods (compounding, monthly returns) are UTC
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
    }

    public static void main(String[] args) {
        SpringApplication.run(QuantBacktestApplication.class, args);
    }
}
