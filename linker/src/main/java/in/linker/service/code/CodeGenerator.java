package in.linker.service.code;

/**
 * Produces candidate short codes.
 *
 * Generators do not check uniqueness; the engine detects collisions on insert
 * and asks for another code.
 */
@FunctionalInterface
public interface CodeGenerator {

    String generate();
}
