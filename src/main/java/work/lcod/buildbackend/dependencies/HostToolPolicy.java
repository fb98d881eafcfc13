package work.lcod.buildbackend.dependencies;

import java.util.List;

/**
 * Names the tool packages an ecosystem needs in the host environment, given what the project
 * already declares.
 */
@FunctionalInterface
public interface HostToolPolicy {
    HostToolPolicy NONE = dependencies -> List.of();

    List<String> requiredHostPackages(ClassifiedDependencies dependencies);

    static HostToolPolicy fixed(String... packages) {
        List<String> names = List.of(packages);
        return dependencies -> names;
    }
}
