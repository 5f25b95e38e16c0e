package win.ixuni.hubstore.driver.github.client.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Commit author identity
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Committer {

    private String name;

    private String email;
}
