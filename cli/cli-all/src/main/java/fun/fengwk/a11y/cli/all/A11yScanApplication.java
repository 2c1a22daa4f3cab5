package fun.fengwk.a11y.cli.all;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.a11y")
public class A11yScanApplication {

    public static void main(String[] args) {
        // Close the context once the runner returns, stopping the queue and the browser.
        System.exit(SpringApplication.exit(SpringApplication.run(A11yScanApplication.class, args)));
    }

}
